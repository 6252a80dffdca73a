/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.tidelog.store.filesystem;

import dev.mars.tidelog.api.error.ObjectStoreException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.store.ByteRange;
import dev.mars.tidelog.api.store.ListPage;
import dev.mars.tidelog.api.store.LocatorFetcher;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.store.LocatorQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Object store backed by a local directory. Each key maps to a file under the
 * root directory, with {@code /} in keys becoming directory separators.
 *
 * <p>Writes go to a staging file first and are then moved into place
 * atomically, so readers never observe a partially written object. Listing
 * walks the deepest directory implied by the prefix and sorts the keys, which
 * is adequate for local development and tests. Locators are {@code file:}
 * URIs whose query carries an expiry, enforced by {@link #fetch(URI, ByteRange)}
 * against the store's clock.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class FileSystemObjectStore implements ObjectStore, LocatorFetcher {
    private static final Logger logger = LoggerFactory.getLogger(FileSystemObjectStore.class);

    static final String STAGING_DIR = ".staging";

    private final Path root;
    private final Clock clock;

    public FileSystemObjectStore(Path root) {
        this(root, Clock.systemUTC());
    }

    public FileSystemObjectStore(Path root, Clock clock) {
        this.root = Objects.requireNonNull(root, "Root directory cannot be null").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        try {
            Files.createDirectories(this.root.resolve(STAGING_DIR));
        } catch (IOException e) {
            throw new ObjectStoreException("Cannot create store root " + this.root, e);
        }
        logger.info("File system object store rooted at {}", this.root);
    }

    @Override
    public void put(String key, byte[] data) {
        Path target = resolve(key);
        Path staging = root.resolve(STAGING_DIR).resolve(UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            Files.write(staging, data);
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to write " + key, e);
        } finally {
            try {
                Files.deleteIfExists(staging);
            } catch (IOException e) {
                logger.warn("Failed to remove staging file {}", staging, e);
            }
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.of(Files.readAllBytes(resolve(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to read " + key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key, ByteRange range) {
        Path path = resolve(key);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(readRange(path, range));
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to delete " + key, e);
        }
    }

    @Override
    public ListPage list(String prefix, String startAfter, int maxKeys) {
        if (maxKeys < 1) {
            throw new IllegalArgumentException("maxKeys must be positive");
        }
        int slash = prefix.lastIndexOf('/');
        Path base = slash < 0 ? root : root.resolve(prefix.substring(0, slash));
        if (!Files.isDirectory(base)) {
            return ListPage.last(List.of());
        }
        List<String> matching;
        try (Stream<Path> paths = Files.walk(base)) {
            matching = paths
                .filter(Files::isRegularFile)
                .map(this::toKey)
                .filter(key -> !key.startsWith(STAGING_DIR + "/"))
                .filter(key -> key.startsWith(prefix))
                .filter(key -> startAfter == null || key.compareTo(startAfter) > 0)
                .sorted()
                .limit(maxKeys + 1L)
                .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to list " + prefix, e);
        }
        if (matching.size() > maxKeys) {
            List<String> page = matching.subList(0, maxKeys);
            return new ListPage(page, page.get(page.size() - 1));
        }
        return ListPage.last(matching);
    }

    @Override
    public URI presign(String key, ByteRange range, Duration ttl) {
        Path path = resolve(key);
        try {
            return new URI("file", null, path.toUri().getPath(), LocatorQuery.encode(clock.instant().plus(ttl), range),
                null);
        } catch (URISyntaxException e) {
            throw new ObjectStoreException("Cannot build locator for " + key, e);
        }
    }

    @Override
    public byte[] fetch(URI locator, ByteRange range) {
        if (!"file".equals(locator.getScheme())) {
            throw new ObjectStoreException(TideLogErrorCodes.LOCATOR_UNSUPPORTED,
                    "Not a file locator: " + locator, null);
        }
        Path path = pathOf(locator);
        if (!path.startsWith(root)) {
            throw new ObjectStoreException(TideLogErrorCodes.LOCATOR_UNSUPPORTED,
                    "Locator outside store root: " + locator, null);
        }
        LocatorQuery.checkNotExpired(locator, clock);
        if (!Files.isRegularFile(path)) {
            throw new ObjectStoreException("No object behind locator " + locator);
        }
        return readRange(path, range);
    }

    private static Path pathOf(URI locator) {
        try {
            return Path.of(new URI("file", null, locator.getPath(), null)).toAbsolutePath().normalize();
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new ObjectStoreException(TideLogErrorCodes.LOCATOR_UNSUPPORTED, "Malformed file locator: " + locator, e);
        }
    }

    private byte[] readRange(Path path, ByteRange range) {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long available = Math.max(0, Math.min(range.end(), channel.size()) - range.offset());
            ByteBuffer buffer = ByteBuffer.allocate((int) available);
            long position = range.offset();
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }
            if (buffer.hasRemaining()) {
                byte[] partial = new byte[buffer.position()];
                buffer.flip();
                buffer.get(partial);
                return partial;
            }
            return buffer.array();
        } catch (NoSuchFileException e) {
            throw new ObjectStoreException("Object disappeared while reading " + path, e);
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to read range " + range + " of " + path, e);
        }
    }

    private Path resolve(String key) {
        Objects.requireNonNull(key, "Key cannot be null");
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Key escapes store root: " + key);
        }
        return path;
    }

    private String toKey(Path path) {
        return root.relativize(path).toString().replace(path.getFileSystem().getSeparator(), "/");
    }

    public Path getRoot() {
        return root;
    }
}
