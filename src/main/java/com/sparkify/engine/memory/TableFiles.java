package com.sparkify.engine.memory;

import com.sparkify.error.SourceReadException;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.LocatedFileStatus;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.RemoteIterator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * File listing through Hadoop {@link FileSystem}, with the same visibility rule Spark's file
 * sources apply: anything below the base with a path segment starting with {@code _} or
 * {@code .} is skipped, so {@code _SUCCESS} markers, {@code _temporary/} and {@code .crc} files
 * never reach a reader.
 */
final class TableFiles {

    private final Configuration conf;

    TableFiles(Configuration conf) {
        this.conf = conf;
    }

    FileSystem fileSystem(Path path) throws IOException {
        return path.getFileSystem(conf);
    }

    /**
     * Files matching a glob pattern, or every visible file below a directory. Sorted by path.
     *
     * @throws SourceReadException if nothing matches
     */
    List<Path> expand(String location) {
        List<Path> files = new ArrayList<>();
        try {
            Path pattern = new Path(location);
            FileSystem fs = fileSystem(pattern);
            Path base = fs.makeQualified(globBase(pattern));

            FileStatus[] matches = fs.globStatus(pattern);
            if (matches == null) {
                throw new SourceReadException(location, "Path does not exist");
            }
            for (FileStatus match : matches) {
                if (match.isDirectory()) {
                    files.addAll(listVisible(fs, match.getPath(), ""));
                } else if (!isHiddenBelow(base, match.getPath())) {
                    files.add(match.getPath());
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new SourceReadException(location, e.getMessage(), e);
        }

        if (files.isEmpty()) {
            throw new SourceReadException(location, "Path does not exist or matches no files");
        }
        Collections.sort(files);
        return files;
    }

    /**
     * Every visible file below {@code root} whose name ends with {@code suffix}, sorted by path.
     */
    List<Path> listVisible(FileSystem fs, Path root, String suffix) throws IOException {
        Path base = fs.makeQualified(root);
        List<Path> files = new ArrayList<>();
        RemoteIterator<LocatedFileStatus> it = fs.listFiles(base, true);
        while (it.hasNext()) {
            Path file = it.next().getPath();
            if (file.getName().endsWith(suffix) && !isHiddenBelow(base, file)) {
                files.add(file);
            }
        }
        Collections.sort(files);
        return files;
    }

    static boolean isHiddenBelow(Path base, Path file) {
        for (Path p = file; p != null && !p.equals(base); p = p.getParent()) {
            if (isHidden(p.getName())) {
                return true;
            }
        }
        return false;
    }

    // "_col=value" is a partition directory, not a hidden one
    static boolean isHidden(String name) {
        return (name.startsWith("_") && !name.contains("=")) || name.startsWith(".")
                || name.endsWith("._COPYING_");
    }

    // deepest ancestor of the pattern without wildcards
    private static Path globBase(Path pattern) {
        Path base = pattern;
        while (base.getParent() != null && isGlob(base.toString())) {
            base = base.getParent();
        }
        return base;
    }

    static boolean isGlob(String location) {
        return location.indexOf('*') >= 0 || location.indexOf('?') >= 0
                || location.indexOf('[') >= 0 || location.indexOf('{') >= 0;
    }
}
