package ai.docsite.plaintext.bundle;

import ai.docsite.plaintext.convert.ConversionException;
import ai.docsite.plaintext.convert.FailureKind;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Temporary work space holding an unpacked (zip) or hard-linked (directory) copy of a bundle.
 *
 * <p>The directory is removed on {@link #close()} unless it was created with {@code keep}.
 */
public final class BundleWorkspace implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BundleWorkspace.class);
    private static final String PREFIX = "docsite-plaintext";

    private final Path root;
    private final boolean keep;

    private BundleWorkspace(Path root, boolean keep) {
        this.root = root;
        this.keep = keep;
    }

    /**
     * Creates a work space for {@code bundle} under {@code tmpdir} (the JVM temp directory when
     * {@code null}). Hard-linking requires the temp directory to share a filesystem with the bundle.
     */
    public static BundleWorkspace create(Path bundle, Path tmpdir, boolean keep) {
        if (!Files.exists(bundle)) {
            throw new ConversionException(FailureKind.INPUT, "Bundle not found: " + bundle);
        }
        Path root;
        try {
            root = tmpdir == null
                    ? Files.createTempDirectory(PREFIX)
                    : Files.createTempDirectory(tmpdir, PREFIX);
        } catch (IOException ex) {
            throw new ConversionException(FailureKind.WORKSPACE, "Failed to create temporary directory: " + ex.getMessage(), ex);
        }
        BundleWorkspace workspace = new BundleWorkspace(root, keep);
        try {
            Files.createDirectory(workspace.outputDirectory());
            if (Files.isDirectory(bundle)) {
                LOGGER.debug("Hard-linking bundle directory {} into {}", bundle, root);
                hardLinkTree(bundle.toAbsolutePath(), workspace.bundleDirectory());
            } else {
                LOGGER.debug("Unpacking bundle {} into {}", bundle, root);
                Files.createDirectory(workspace.bundleDirectory());
                unzip(bundle, workspace.bundleDirectory());
            }
            return workspace;
        } catch (IOException | RuntimeException ex) {
            workspace.close();
            if (ex instanceof ConversionException conversionException) {
                throw conversionException;
            }
            throw new ConversionException(FailureKind.WORKSPACE, "Failed to prepare work space: " + ex.getMessage(), ex);
        }
    }

    public Path root() {
        return root;
    }

    public Path bundleDirectory() {
        return root.resolve("bundle");
    }

    public Path outputDirectory() {
        return root.resolve("output");
    }

    @Override
    public void close() {
        if (keep) {
            LOGGER.info("Keeping work space {}", root);
            return;
        }
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to clean up work space {}: {}", root, ex.getMessage());
        }
    }

    private static void hardLinkTree(Path from, Path to) throws IOException {
        Files.createDirectory(to);
        try (Stream<Path> children = Files.list(from)) {
            for (Path child : children.sorted().collect(Collectors.toList())) {
                Path target = to.resolve(child.getFileName().toString());
                BasicFileAttributes attributes = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                if (attributes.isRegularFile()) {
                    link(target, child);
                } else if (attributes.isDirectory()) {
                    hardLinkTree(child, target);
                }
                // symlinks and special files are skipped
            }
        }
    }

    private static void link(Path target, Path existing) throws IOException {
        try {
            Files.createLink(target, existing);
        } catch (FileSystemException ex) {
            String reason = ex.getReason();
            if (reason != null && reason.toLowerCase(Locale.ROOT).contains("cross-device")) {
                throw new ConversionException(FailureKind.WORKSPACE,
                        "TMPDIR must be on same filesystem as bundle dir", ex);
            }
            throw ex;
        }
    }

    private static void unzip(Path archive, Path destination) throws IOException {
        Path base = destination.toAbsolutePath().normalize();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                Path target = base.resolve(entry.getName()).normalize();
                if (!target.startsWith(base)) {
                    throw new ConversionException(FailureKind.WORKSPACE,
                            "Bundle entry outside of work space: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream input = zip.getInputStream(entry)) {
                    Files.copy(input, target, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }
}
