package org.stianloader.jarresolver.internal;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;

public class FileUtil {

    /**
     * Deletes a file or a directory, including everything within it. Nothing happens if the path does not exist.
     *
     * @param path The file or directory to delete
     * @throws IOException If anything could not be deleted
     */
    public static void delete(@NotNull Path path) throws IOException {
        if (Files.notExists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            try (DirectoryStream<Path> ds = Files.newDirectoryStream(path)) {
                for (Path child : ds) {
                    FileUtil.delete(child);
                }
            }
        }
        Files.delete(path);
    }

    /**
     * Strips the extension of a file name, that is everything after the last dot.
     *
     * @param fileName The name of the file
     * @return The file name without extension, or the file name itself if it has none
     */
    @NotNull
    public static String stripExtension(@NotNull String fileName) {
        int index = fileName.lastIndexOf('.');
        if (index <= 0) {
            return fileName;
        }
        return fileName.substring(0, index);
    }
}
