package com.z254.sentinel.guardian.ticket;

import com.z254.sentinel.guardian.config.GuardianProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Ticket store backed by markdown files in the ticket directory.
 * <p>
 * Files are created with {@code CREATE_NEW}, so a name collision fails instead of
 * overwriting. Only {@code guardian-*} files are read, moved or rewritten.
 */
@Slf4j
@Repository
public class FileTicketRepository implements TicketRepository {

    static final int LOCK_STRIPES = 64;

    private final Path directory;
    private final Path archiveDirectory;
    private final ReentrantLock[] lockStripes = new ReentrantLock[LOCK_STRIPES];

    @Autowired
    public FileTicketRepository(GuardianProperties properties) {
        this(Path.of(properties.getWorkingDirectory()).resolve(properties.getTickets().getDirectory()),
                properties.getTickets().getArchiveDirectory());
    }

    public FileTicketRepository(Path directory, String archiveDirectory) {
        this.directory = directory.toAbsolutePath().normalize();
        this.archiveDirectory = this.directory.resolve(archiveDirectory);
        for (int i = 0; i < lockStripes.length; i++) {
            lockStripes[i] = new ReentrantLock();
        }
    }

    @Override
    public List<Ticket> findAll() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Ticket> tickets = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Optional<TicketName> name = TicketName.parse(file.getFileName().toString());
                if (name.isEmpty() || !Files.isRegularFile(file)) {
                    continue;
                }
                read(file, name.get()).ifPresent(tickets::add);
            }
        } catch (IOException e) {
            throw new TicketStoreException("Failed to list tickets in " + directory, e);
        }
        tickets.sort(Comparator.comparing(Ticket::getCreatedAt).thenComparing(Ticket::getFileName));
        return tickets;
    }

    @Override
    public Ticket create(TicketDraft draft) {
        Path file = directory.resolve(draft.getName().fileName());
        String text = TicketDocument.render(draft.getFrontMatter(), draft.getLines());
        try {
            Files.createDirectories(directory);
            Files.writeString(file, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            throw new TicketStoreException("Ticket already exists: " + file.getFileName(), e);
        } catch (IOException e) {
            throw new TicketStoreException("Failed to write ticket " + file.getFileName(), e);
        }
        return Ticket.builder()
                .name(draft.getName())
                .frontMatter(new LinkedHashMap<>(draft.getFrontMatter()))
                .body(text)
                .build();
    }

    @Override
    public Ticket refresh(Ticket ticket, Instant refreshedAt) {
        TicketName refreshedName = ticket.getName().withCreatedAt(refreshedAt);
        Map<String, String> frontMatter = new LinkedHashMap<>(ticket.getFrontMatter());
        frontMatter.put(TicketDocument.CREATED, refreshedAt.toString());
        frontMatter.put(TicketDocument.COUNT, String.valueOf(ticket.getCount() + 1));
        String text = TicketDocument.render(frontMatter, List.of())
                + TicketDocument.content(ticket.getBody());

        Path source = directory.resolve(ticket.getFileName());
        Path target = directory.resolve(refreshedName.fileName());
        try {
            Files.writeString(target, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            if (!source.equals(target)) {
                Files.deleteIfExists(source);
            }
        } catch (IOException e) {
            throw new TicketStoreException("Failed to refresh ticket " + ticket.getFileName(), e);
        }
        return Ticket.builder().name(refreshedName).frontMatter(frontMatter).body(text).build();
    }

    @Override
    public CleanupResult archiveOlderThan(Instant cutoff) {
        CleanupResult.CleanupResultBuilder result = CleanupResult.builder();
        int archived = 0;
        int kept = 0;
        for (Ticket ticket : findAll()) {
            if (!ticket.getCreatedAt().isBefore(cutoff)) {
                kept++;
                continue;
            }
            try {
                Files.createDirectories(archiveDirectory);
                Files.move(directory.resolve(ticket.getFileName()), archiveDirectory.resolve(ticket.getFileName()));
                archived++;
            } catch (IOException e) {
                log.warn("Failed to archive ticket {}: {}", ticket.getFileName(), e.getMessage());
                result.error(ticket.getFileName() + ": " + e.getMessage());
                kept++;
            }
        }
        return result.archivedCount(archived).keptCount(kept).build();
    }

    @Override
    public <T> T withFingerprintLocks(Collection<String> fingerprints, Supplier<T> action) {
        // Fixed stripe set, acquired in index order
        TreeSet<Integer> stripes = new TreeSet<>();
        for (String fingerprint : fingerprints) {
            stripes.add(stripeOf(fingerprint));
        }
        List<ReentrantLock> held = new ArrayList<>();
        try {
            for (int stripe : stripes) {
                ReentrantLock lock = lockStripes[stripe];
                lock.lock();
                held.add(lock);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    static int stripeOf(String fingerprint) {
        return Math.floorMod(fingerprint.hashCode(), LOCK_STRIPES);
    }

    int heldStripes() {
        int held = 0;
        for (ReentrantLock lock : lockStripes) {
            if (lock.isLocked()) {
                held++;
            }
        }
        return held;
    }

    public Path getDirectory() {
        return directory;
    }

    public Path getArchiveDirectory() {
        return archiveDirectory;
    }

    private Optional<Ticket> read(Path file, TicketName name) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.of(Ticket.builder()
                    .name(name)
                    .frontMatter(TicketDocument.parseFrontMatter(text))
                    .body(text)
                    .build());
        } catch (NoSuchFileException e) {
            // Archived or refreshed by a concurrent cycle between list and read
            log.debug("Ticket {} disappeared before it could be read", file.getFileName());
            return Optional.empty();
        } catch (IOException e) {
            throw new TicketStoreException("Failed to read ticket " + file.getFileName(), e);
        }
    }
}
