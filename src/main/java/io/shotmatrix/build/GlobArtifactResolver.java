package io.shotmatrix.build;

import io.shotmatrix.config.RootConfig;
import io.shotmatrix.model.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Optional;

/**
 * Picks the most recently modified file or bundle matching the configured {@code artifact_glob}.
 * iOS {@code .app} bundles are directories, so directories match too.
 */
public final class GlobArtifactResolver implements ArtifactResolver {
    private static final Logger log = LoggerFactory.getLogger(GlobArtifactResolver.class);
    private static final String DEFAULT_IOS_GLOB = "**/*.app";
    private static final String DEFAULT_ANDROID_GLOB = "**/*.apk";

    private final Path baseDirectory;

    public GlobArtifactResolver() {
        this(Path.of("").toAbsolutePath());
    }

    public GlobArtifactResolver(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    @Override
    public Optional<Path> resolve(Platform platform, RootConfig.PlatformBuildConfig buildConfig) {
        String glob = buildConfig == null || buildConfig.artifactGlob() == null || buildConfig.artifactGlob().isBlank()
                ? (platform == Platform.IOS ? DEFAULT_IOS_GLOB : DEFAULT_ANDROID_GLOB)
                : buildConfig.artifactGlob().trim();
        if (!Files.isDirectory(baseDirectory)) {
            return Optional.empty();
        }
        PathMatcher deep = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        // "**/" needs at least one directory level, so top-level hits get their own matcher.
        PathMatcher shallow = glob.startsWith("**/")
                ? FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3))
                : deep;
        PathMatcher matcher = path -> deep.matches(path) || shallow.matches(path);
        Latest latest = new Latest();
        try {
            Files.walkFileTree(baseDirectory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(baseDirectory) && matches(matcher, dir)) {
                        latest.offer(dir, attrs.lastModifiedTime());
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (matches(matcher, file)) {
                        latest.offer(file, attrs.lastModifiedTime());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to search for " + platform.displayName() + " artifacts", e);
        }
        if (latest.path == null) {
            log.debug("No {} artifact matches '{}' under {}", platform.displayName(), glob, baseDirectory);
            return Optional.empty();
        }
        log.info("Using {} artifact {}", platform.displayName(), latest.path);
        return Optional.of(latest.path);
    }

    private boolean matches(PathMatcher matcher, Path candidate) {
        return matcher.matches(baseDirectory.relativize(candidate));
    }

    private static final class Latest {
        private Path path;
        private FileTime modified;

        void offer(Path candidate, FileTime time) {
            if (path == null || time.compareTo(modified) > 0) {
                path = candidate;
                modified = time;
            }
        }
    }
}
