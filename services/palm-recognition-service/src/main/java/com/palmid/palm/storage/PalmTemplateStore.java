package com.palmid.palm.storage;

import com.palmid.common.concurrent.ConcurrencyUtils;
import com.palmid.common.exception.ErrorCode;
import com.palmid.palm.domain.PalmRegistration;
import com.palmid.palm.domain.PalmTemplate;
import com.palmid.palm.domain.RegistrationSummary;
import com.palmid.palm.exception.DuplicateRegistrationException;
import com.palmid.palm.exception.InvalidIdentityException;
import com.palmid.palm.exception.PalmStorageException;
import com.palmid.palm.metrics.PalmRecognitionMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.palmid.palm.util.PalmLogMasking.maskIdentity;

/**
 * Durable per-identity palm registration store: one JSON file per identity.
 *
 * <p>Writes (register, save, touch, delete and corrupt-record removal) hold the identity's lock
 * stripe.
 * Reads take no lock: every write goes to a temp file that is renamed over the record, so a
 * reader sees either the old or the new record, never a partial one.
 *
 * <p>A record that cannot be parsed is deleted and reported as absent.
 */
@Slf4j
public class PalmTemplateStore {

    static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    // used as a file name: no separators, no leading dot, lower case only so that two
    // identities never share a file on a case-insensitive filesystem
    private static final Pattern IDENTITY_PATTERN = Pattern.compile("[a-z0-9+_@-][a-z0-9+_.@-]{0,63}");

    static final int LOCK_STRIPES = 64;

    private final Path directory;
    private final PalmRecordSerializer serializer;
    private final PalmRecognitionMetrics metrics;
    private final Clock clock;
    private final ReentrantLock[] lockStripes = new ReentrantLock[LOCK_STRIPES];

    public PalmTemplateStore(Path directory, PalmRecordSerializer serializer,
                             PalmRecognitionMetrics metrics, Clock clock) {
        this.directory = directory.toAbsolutePath().normalize();
        this.serializer = serializer;
        this.metrics = metrics;
        this.clock = clock;
        for (int i = 0; i < lockStripes.length; i++) {
            lockStripes[i] = new ReentrantLock();
        }
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new PalmStorageException("Cannot create palm data directory " + this.directory, e);
        }
        log.info("Palm template store initialized at {}", this.directory);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * @throws InvalidIdentityException if the identity cannot be used as a record key
     */
    public String requireValidIdentity(String identity) {
        if (identity == null || !IDENTITY_PATTERN.matcher(identity).matches()) {
            throw new InvalidIdentityException("Identity must be 1-64 characters of lower-case letters, digits or "
                + "'+', '_', '.', '@', '-' and must not start with '.'");
        }
        return identity;
    }

    public Optional<PalmRegistration> load(String identity) {
        requireValidIdentity(identity);
        RecordReadResult result = readRecord(identity);
        switch (result.getStatus()) {
            case VALID:
                return result.getRegistration();
            case CORRUPT:
                return healCorruptRecord(identity, result);
            default:
                return Optional.empty();
        }
    }

    public void save(PalmRegistration registration) {
        String identity = requireValidIdentity(registration.getIdentity());
        byte[] content = serializer.write(registration);
        ConcurrencyUtils.withLockVoid(lockFor(identity), () -> writeAtomically(identity, content));
        log.debug("Saved palm data for {}", maskIdentity(identity));
    }

    /**
     * @return whether a record existed
     */
    public boolean delete(String identity) {
        requireValidIdentity(identity);
        boolean deleted = ConcurrencyUtils.withLock(lockFor(identity), () -> deleteRecord(identity));
        if (deleted) {
            metrics.recordDeletion();
            log.info("Palm data deleted for {}", maskIdentity(identity));
        } else {
            log.info("No palm data found for {}", maskIdentity(identity));
        }
        return deleted;
    }

    /**
     * Persist a new registration built from {@code template}.
     *
     * @throws DuplicateRegistrationException if the identity already has a valid record;
     *         the existing record is left untouched
     */
    public PalmRegistration register(String identity, PalmTemplate template) {
        requireValidIdentity(identity);
        PalmRegistration registration = ConcurrencyUtils.withLock(lockFor(identity), () -> {
            if (load(identity).isPresent()) {
                throw new DuplicateRegistrationException(identity);
            }
            PalmRegistration created = PalmRegistration.fromTemplate(identity, template, clock.instant());
            save(created);
            return created;
        });
        metrics.recordRegistration();
        log.info("Palm registered for {} with signature {}", maskIdentity(identity), registration.getSignature());
        return registration;
    }

    /**
     * Set {@code lastUsed} of an existing registration. Empty if the identity is not registered.
     */
    public Optional<PalmRegistration> touch(String identity, Instant usedAt) {
        requireValidIdentity(identity);
        return ConcurrencyUtils.withLock(lockFor(identity), () -> load(identity).map(current -> {
            PalmRegistration updated = current.withLastUsed(usedAt);
            save(updated);
            return updated;
        }));
    }

    /**
     * All valid registrations ordered by identity. Corrupt records are removed and skipped;
     * records written during the scan may or may not be included.
     */
    public List<PalmRegistration> loadAll() {
        List<PalmRegistration> registrations = new ArrayList<>();
        for (String identity : listIdentities()) {
            try {
                load(identity).ifPresent(registrations::add);
            } catch (PalmStorageException e) {
                log.error("Skipping unreadable palm record for {}", maskIdentity(identity), e);
            }
        }
        registrations.sort(Comparator.comparing(PalmRegistration::getIdentity));
        return registrations;
    }

    public List<RegistrationSummary> listAll() {
        return loadAll().stream()
            .map(PalmRegistration::toSummary)
            .collect(Collectors.toList());
    }

    Path recordPath(String identity) {
        return directory.resolve(identity + RECORD_SUFFIX);
    }

    private List<String> listIdentities() {
        List<String> identities = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + RECORD_SUFFIX)) {
            for (Path file : stream) {
                String fileName = file.getFileName().toString();
                String identity = fileName.substring(0, fileName.length() - RECORD_SUFFIX.length());
                if (Files.isRegularFile(file) && IDENTITY_PATTERN.matcher(identity).matches()) {
                    identities.add(identity);
                } else {
                    log.debug("Ignoring foreign file {} in palm data directory", fileName);
                }
            }
        } catch (IOException e) {
            throw new PalmStorageException("Failed to list palm data directory " + directory, e);
        }
        return identities;
    }

    private RecordReadResult readRecord(String identity) {
        RecordReadResult result = serializer.read(recordPath(identity));
        if (result.getStatus() == RecordReadResult.Status.VALID
                && !identity.equals(result.getRegistration().map(PalmRegistration::getIdentity).orElse(null))) {
            return RecordReadResult.corrupt("record identity does not match file name");
        }
        return result;
    }

    private Optional<PalmRegistration> healCorruptRecord(String identity, RecordReadResult firstRead) {
        return ConcurrencyUtils.withLock(lockFor(identity), () -> {
            // a writer may have replaced the file since the unlocked read
            RecordReadResult current = readRecord(identity);
            if (current.getStatus() != RecordReadResult.Status.CORRUPT) {
                return current.getRegistration();
            }
            log.warn("[{}] Corrupted palm data for {} ({}), deleting", ErrorCode.BIO_TEMPLATE_CORRUPTED.getCode(),
                maskIdentity(identity), current.getProblem().orElse(firstRead.getProblem().orElse("unknown problem")));
            metrics.recordCorruptRecord();
            try {
                Files.deleteIfExists(recordPath(identity));
            } catch (IOException e) {
                log.error("Failed to delete corrupted palm data for {}", maskIdentity(identity), e);
            }
            return Optional.empty();
        });
    }

    private boolean deleteRecord(String identity) {
        try {
            return Files.deleteIfExists(recordPath(identity));
        } catch (IOException e) {
            throw new PalmStorageException("Failed to delete palm data for " + maskIdentity(identity), e);
        }
    }

    private void writeAtomically(String identity, byte[] content) {
        Path target = recordPath(identity);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + identity + ".", TEMP_SUFFIX);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, falling back to replace", directory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            PalmStorageException failure = new PalmStorageException(
                "Failed to save palm data for " + maskIdentity(identity), e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    // fixed stripe count bounds lock memory; identities sharing a stripe only serialize writes
    ReentrantLock lockFor(String identity) {
        return lockStripes[Math.floorMod(identity.hashCode(), lockStripes.length)];
    }
}
