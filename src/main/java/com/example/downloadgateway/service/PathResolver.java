package com.example.downloadgateway.service;

import com.example.downloadgateway.exception.DownloadErrorCode;
import com.example.downloadgateway.exception.DownloadException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Validates requested file names against the download root.
 */
@Slf4j
public class PathResolver {

    @Getter
    private final Path root;

    /**
     * @param rootDir existing root directory; stored in its canonical form
     */
    public PathResolver(Path rootDir) {
        try {
            this.root = rootDir.toAbsolutePath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("Download root is not accessible: " + rootDir, e);
        }
    }

    /**
     * Joins the requested name under the root and checks that the result stays inside it.
     * Containment is decided on path components, so a sibling such as {@code files2}
     * never passes for a root named {@code files}.
     *
     * @return the normalized absolute path, whose file name is the requested base name
     * @throws DownloadException with {@code INVALID_INPUT} or {@code PATH_ESCAPE}
     */
    public Path resolve(String requestedName) {
        if (requestedName == null || requestedName.isEmpty()) {
            throw new DownloadException(DownloadErrorCode.INVALID_INPUT, "File name is required");
        }

        String relative = stripLeadingSeparators(requestedName);
        Path candidate;
        try {
            candidate = root.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            throw new DownloadException(DownloadErrorCode.INVALID_INPUT, "Malformed file name: " + requestedName, e);
        }

        if (!candidate.startsWith(root)) {
            throw new DownloadException(DownloadErrorCode.PATH_ESCAPE, "Invalid file path: " + requestedName);
        }

        // symlinks inside the root must not lead out of it
        if (Files.exists(candidate)) {
            Path real;
            try {
                real = candidate.toRealPath();
            } catch (IOException e) {
                throw new DownloadException(DownloadErrorCode.IO_ERROR, "Cannot canonicalize " + requestedName, e);
            }
            if (!real.startsWith(root)) {
                throw new DownloadException(DownloadErrorCode.PATH_ESCAPE, "Invalid file path: " + requestedName);
            }
        }

        return candidate;
    }

    private static String stripLeadingSeparators(String name) {
        int start = 0;
        while (start < name.length() && (name.charAt(start) == '/' || name.charAt(start) == '\\')) {
            start++;
        }
        return name.substring(start);
    }
}
