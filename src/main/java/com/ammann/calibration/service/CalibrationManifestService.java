/* (C)2026 */
package com.ammann.calibration.service;

import com.ammann.calibration.canonical.CanonicalJson;
import com.ammann.calibration.exception.ManifestEntryNotFoundException;
import com.ammann.calibration.exception.SomeThingWentWrongException;
import com.ammann.calibration.exception.ValidationException;
import com.ammann.calibration.model.CalibrationManifestEntry;
import com.ammann.calibration.model.ChainVerification;
import com.ammann.calibration.model.ManifestInputs;
import com.ammann.calibration.model.ManifestVerification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Append-only, hash-chained audit trail of fusion decisions.
 *
 * <p>Each entry stores the canonical JSON of its inputs, the SHA-256 of that string and
 * a chain hash {@code sha256(previous_hash|inputs_hash|sequence)}. The first entry
 * chains to {@link CanonicalJson#GENESIS_HASH}. When a signing key is configured every
 * entry also carries an HMAC-SHA256 signature.
 *
 * <p>Appends are serialized by a single lock that also guards the optional JSON-lines
 * journal. Reads never lock. No entry is ever edited or removed.
 *
 * <p>The whole trail stays in memory for the life of the process so that
 * {@link #verifyChain()} can walk it from genesis. Memory therefore grows linearly with
 * the number of decisions, each entry holding its canonical inputs string, and every
 * append copies the backing array. The JSON-lines journal
 * ({@code calibration.manifest.journal-path}) is the durable copy.
 */
@ApplicationScoped
public class CalibrationManifestService {

    private static final Logger LOG = Logger.getLogger(CalibrationManifestService.class);

    static final int MAX_PAGE_SIZE = 100;

    private static final ObjectMapper JOURNAL_MAPPER = JsonMapper.builder().build();

    @ConfigProperty(name = "calibration.manifest.signing-key")
    Optional<String> signingKey = Optional.empty();

    @ConfigProperty(name = "calibration.manifest.journal-path")
    Optional<String> journalPath = Optional.empty();

    @Inject MeterRegistry meterRegistry;

    // Copy-on-write: O(n) per append, lock-free snapshots for readers.
    private final List<CalibrationManifestEntry> entries = new CopyOnWriteArrayList<>();
    private final ReentrantLock appendLock = new ReentrantLock();
    private Counter entriesCounter;

    @PostConstruct
    void init() {
        LOG.infof(
                "Calibration manifest ready (signing=%s, journal=%s)",
                isSigningEnabled() ? "HMAC-SHA256" : "off", journalPath.orElse("off"));
        if (meterRegistry != null) {
            entriesCounter =
                    Counter.builder("manifest_entries_total")
                            .description("Fusion decisions recorded in the calibration manifest")
                            .register(meterRegistry);
        }
    }

    /**
     * Canonicalizes, hashes, chains and optionally signs one decision, then appends it.
     *
     * @param inputs decision inputs and outcome
     * @return the appended entry
     */
    public CalibrationManifestEntry record(ManifestInputs inputs) {
        String canonical = CanonicalJson.write(inputs);
        String inputsHash = CanonicalJson.sha256Hex(canonical);

        appendLock.lock();
        try {
            long sequence = entries.size();
            String previousHash =
                    entries.isEmpty() ? CanonicalJson.GENESIS_HASH : entries.get(entries.size() - 1).entryHash();
            String entryHash = chainHash(previousHash, inputsHash, sequence);
            String signature = signingKey
                    .filter(key -> !key.isBlank())
                    .map(key -> CanonicalJson.hmacSha256Hex(key, signedMessage(canonical, inputsHash, entryHash)))
                    .orElse(null);

            CalibrationManifestEntry entry = new CalibrationManifestEntry(
                    sequence, inputs, canonical, inputsHash, previousHash, entryHash, Instant.now(), signature);
            journal(entry);
            entries.add(entry);
            if (entriesCounter != null) {
                entriesCounter.increment();
            }
            LOG.debugf("Manifest entry %d recorded for unit %s (%s)", sequence, inputs.unitId(), entryHash);
            return entry;
        } finally {
            appendLock.unlock();
        }
    }

    /** Snapshot of all entries, oldest first. */
    public List<CalibrationManifestEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * Most recent entries, newest first.
     *
     * @param limit number of entries, 1 to {@value #MAX_PAGE_SIZE}
     */
    public List<CalibrationManifestEntry> latest(int limit) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw ValidationException.invalidParameter(
                    "limit", limit, "a value between 1 and " + MAX_PAGE_SIZE);
        }
        List<CalibrationManifestEntry> snapshot = new ArrayList<>(entries);
        List<CalibrationManifestEntry> result = new ArrayList<>();
        for (int i = snapshot.size() - 1; i >= 0 && result.size() < limit; i--) {
            result.add(snapshot.get(i));
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    public CalibrationManifestEntry entry(long sequence) {
        List<CalibrationManifestEntry> snapshot = new ArrayList<>(entries);
        if (sequence < 0 || sequence >= snapshot.size()) {
            throw new ManifestEntryNotFoundException(sequence, snapshot.size());
        }
        return snapshot.get((int) sequence);
    }

    public boolean isSigningEnabled() {
        return signingKey.filter(key -> !key.isBlank()).isPresent();
    }

    /**
     * Re-derives the digests of one entry and checks its link to the predecessor and,
     * when possible, its signature.
     */
    public ManifestVerification verify(long sequence) {
        CalibrationManifestEntry entry = entry(sequence);
        String expectedPrevious =
                sequence == 0 ? CanonicalJson.GENESIS_HASH : entry(sequence - 1).entryHash();
        return verify(entry, expectedPrevious);
    }

    /**
     * Walks the whole trail from the genesis hash and stops at the first broken entry.
     */
    public ChainVerification verifyChain() {
        List<CalibrationManifestEntry> snapshot = new ArrayList<>(entries);
        String previous = CanonicalJson.GENESIS_HASH;
        for (CalibrationManifestEntry entry : snapshot) {
            ManifestVerification result = verify(entry, previous);
            if (!result.valid()) {
                LOG.warnf("Manifest chain broken at entry %d: %s", entry.sequence(), result.problems());
                return new ChainVerification(
                        (int) entry.sequence() + 1,
                        false,
                        entry.sequence(),
                        previous,
                        String.join("; ", result.problems()));
            }
            previous = entry.entryHash();
        }
        return new ChainVerification(
                snapshot.size(), true, null, previous, "Chain intact over " + snapshot.size() + " entries");
    }

    ManifestVerification verify(CalibrationManifestEntry entry, String expectedPrevious) {
        List<String> problems = new ArrayList<>();

        boolean hashValid = CanonicalJson.sha256Hex(entry.canonicalInputs()).equals(entry.inputsHash())
                && CanonicalJson.write(entry.inputs()).equals(entry.canonicalInputs());
        if (!hashValid) {
            problems.add("inputs hash does not match the canonical inputs");
        }

        boolean chainValid = entry.previousHash().equals(expectedPrevious)
                && chainHash(entry.previousHash(), entry.inputsHash(), entry.sequence()).equals(entry.entryHash());
        if (!chainValid) {
            problems.add("entry hash or predecessor link is inconsistent");
        }

        Boolean signatureValid = null;
        if (entry.isSigned() && isSigningEnabled()) {
            String expected = CanonicalJson.hmacSha256Hex(
                    signingKey.get(), signedMessage(entry.canonicalInputs(), entry.inputsHash(), entry.entryHash()));
            signatureValid = MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.UTF_8), entry.signature().getBytes(StandardCharsets.UTF_8));
            if (!signatureValid) {
                problems.add("signature does not match");
                LOG.warnf("Signature verification failed for manifest entry %d", entry.sequence());
            }
        } else if (entry.isSigned()) {
            problems.add("entry is signed but no signing key is configured to check it");
        }
        return new ManifestVerification(entry.sequence(), hashValid, chainValid, signatureValid, problems);
    }

    static String chainHash(String previousHash, String inputsHash, long sequence) {
        return CanonicalJson.sha256Hex(previousHash + "|" + inputsHash + "|" + sequence);
    }

    private static String signedMessage(String canonical, String inputsHash, String entryHash) {
        return canonical + "|" + inputsHash + "|" + entryHash;
    }

    private void journal(CalibrationManifestEntry entry) {
        if (journalPath.isEmpty() || journalPath.get().isBlank()) {
            return;
        }
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("sequence", entry.sequence());
        line.put("unit_id", entry.unitId());
        line.put("status", entry.status());
        line.put("inputs_hash", entry.inputsHash());
        line.put("previous_hash", entry.previousHash());
        line.put("entry_hash", entry.entryHash());
        line.put("timestamp", entry.timestamp().toString());
        line.put("signature", entry.signature());
        line.put("canonical_inputs", entry.canonicalInputs());
        try {
            Path path = Path.of(journalPath.get());
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    path,
                    JOURNAL_MAPPER.writeValueAsString(line) + System.lineSeparator(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            throw new SomeThingWentWrongException("Failed to serialize manifest entry " + entry.sequence(), e);
        } catch (IOException e) {
            throw new SomeThingWentWrongException(
                    "Failed to append manifest entry " + entry.sequence() + " to " + journalPath.get(), e);
        }
    }
}
