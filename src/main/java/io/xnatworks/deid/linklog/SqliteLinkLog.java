/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.linklog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Link log backed by SQLite with a TSV audit file alongside.
 *
 * <p>Files in the link log directory:
 * <ul>
 *   <li>linklog.db - authoritative keyed store (patient, study, admitted_series, counter, meta)</li>
 *   <li>linklog.tsv - append-only audit projection, {@code studyID<TAB>accessionNumber}</li>
 *   <li>linklog.lock - held while a process has the log open</li>
 * </ul>
 * </p>
 *
 * <p>Every allocation is a single transaction, so a crash leaves either the whole
 * entry or nothing. The full mapping is cached in memory at open; lookups read the
 * caches without locking and all mutations go through synchronized methods.</p>
 */
public class SqliteLinkLog implements LinkLog {
    private static final Logger log = LoggerFactory.getLogger(SqliteLinkLog.class);

    public static final String DB_FILE = "linklog.db";
    public static final String AUDIT_FILE = "linklog.tsv";
    public static final String LOCK_FILE = "linklog.lock";
    public static final String DEFAULT_ID_PREFIX = "ANON";

    private static final String PATIENT_COUNTER = "patient_seq";

    private final Path directory;
    private final String idPrefix;
    private final AuditLogFile auditLog;

    private final Map<String, PatientIdentity> patients = new ConcurrentHashMap<>();
    private final Map<String, StudyLink> studies = new ConcurrentHashMap<>();
    private final Map<String, StudyLink> studiesById = new ConcurrentHashMap<>();
    private final Set<String> admittedSeries = ConcurrentHashMap.newKeySet();

    private Connection connection;
    private FileChannel lockChannel;
    private FileLock lock;
    private String uidSalt;
    private volatile boolean closed;

    private SqliteLinkLog(Path directory, String idPrefix) {
        this.directory = directory;
        this.idPrefix = idPrefix;
        this.auditLog = new AuditLogFile(directory.resolve(AUDIT_FILE));
    }

    /**
     * Open the link log in the given directory, creating it if needed.
     *
     * @throws CorruptLogException if the store or audit file cannot be parsed
     * @throws InconsistentStateException if the audit file contradicts itself or the store
     */
    public static SqliteLinkLog open(Path directory) {
        return open(directory, DEFAULT_ID_PREFIX);
    }

    /**
     * Open the link log, using {@code idPrefix} for newly allocated synthetic identifiers.
     */
    public static SqliteLinkLog open(Path directory, String idPrefix) {
        SqliteLinkLog linkLog = new SqliteLinkLog(directory, idPrefix);
        try {
            linkLog.initialize();
        } catch (RuntimeException e) {
            linkLog.release();
            throw e;
        }
        return linkLog;
    }

    private void initialize() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new LinkLogException("Cannot create link log directory " + directory + ": " + e.getMessage(), e);
        }
        acquireLock();

        Path dbPath = directory.resolve(DB_FILE);
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA synchronous = FULL");
            }
            checkIntegrity();
            createTables();
            loadSalt();
            loadCaches();
        } catch (SQLException e) {
            throw new CorruptLogException("Link log store " + dbPath + " is unreadable: " + e.getMessage(), e);
        }

        List<LinkLogEntry> entries = auditLog.load();
        List<LinkLogEntry> expected = verifyAuditLog(entries);
        if (auditLog.hadTornTail() || entries.size() != expected.size()) {
            log.warn("Audit file {} is behind the store ({} of {} entries), rebuilding it",
                    auditLog.getPath(), entries.size(), expected.size());
            rewriteAudit(expected);
        }

        log.info("Link log opened at {} ({})", directory, stats());
    }

    private void acquireLock() {
        try {
            lockChannel = FileChannel.open(directory.resolve(LOCK_FILE),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            lock = lockChannel.tryLock();
        } catch (OverlappingFileLockException e) {
            throw new LinkLogException("Link log " + directory + " is already open in this process");
        } catch (IOException e) {
            throw new LinkLogException("Cannot lock link log " + directory + ": " + e.getMessage(), e);
        }
        if (lock == null) {
            throw new LinkLogException("Link log " + directory + " is already open in another process");
        }
    }

    private void checkIntegrity() throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA quick_check")) {
            String result = rs.next() ? rs.getString(1) : null;
            if (!"ok".equalsIgnoreCase(result)) {
                throw new CorruptLogException("Link log store failed integrity check: " + result);
            }
        }
    }

    private void createTables() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(
                "CREATE TABLE IF NOT EXISTS patient (" +
                "    real_id TEXT PRIMARY KEY," +
                "    synthetic_id TEXT NOT NULL UNIQUE," +
                "    next_accession INTEGER NOT NULL," +
                "    created_at TEXT NOT NULL" +
                ")");

            stmt.execute(
                "CREATE TABLE IF NOT EXISTS study (" +
                "    real_id TEXT NOT NULL REFERENCES patient(real_id)," +
                "    study_key TEXT NOT NULL," +
                "    accession_seq INTEGER NOT NULL," +
                "    accession TEXT NOT NULL," +
                "    study_id TEXT NOT NULL UNIQUE," +
                "    created_at TEXT NOT NULL," +
                "    PRIMARY KEY (real_id, study_key)," +
                "    UNIQUE (real_id, accession_seq)" +
                ")");

            stmt.execute(
                "CREATE TABLE IF NOT EXISTS admitted_series (" +
                "    id INTEGER PRIMARY KEY AUTOINCREMENT," +
                "    study_id TEXT NOT NULL REFERENCES study(study_id)," +
                "    series_key TEXT NOT NULL," +
                "    admitted_at TEXT NOT NULL," +
                "    UNIQUE (study_id, series_key)" +
                ")");

            stmt.execute(
                "CREATE TABLE IF NOT EXISTS counter (" +
                "    name TEXT PRIMARY KEY," +
                "    value INTEGER NOT NULL" +
                ")");

            stmt.execute(
                "CREATE TABLE IF NOT EXISTS meta (" +
                "    key TEXT PRIMARY KEY," +
                "    value TEXT NOT NULL" +
                ")");
        }
    }

    private void loadSalt() throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement("SELECT value FROM meta WHERE key = 'uid_salt'")) {
            ResultSet rs = stmt.executeQuery();
            if (rs.next()) {
                uidSalt = rs.getString(1);
                return;
            }
        }
        uidSalt = UUID.randomUUID().toString();
        try (PreparedStatement stmt = connection.prepareStatement("INSERT INTO meta (key, value) VALUES ('uid_salt', ?)")) {
            stmt.setString(1, uidSalt);
            stmt.executeUpdate();
        }
    }

    private void loadCaches() throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT real_id, synthetic_id FROM patient")) {
            while (rs.next()) {
                PatientIdentity identity = new PatientIdentity(rs.getString(1), rs.getString(2));
                patients.put(identity.getRealIdentifier(), identity);
            }
        }

        String sql = "SELECT s.real_id, s.study_key, p.synthetic_id, s.accession, s.study_id " +
                "FROM study s JOIN patient p ON p.real_id = s.real_id";
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                StudyLink link = new StudyLink(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4));
                if (!link.getStudyId().equals(rs.getString(5))) {
                    throw new InconsistentStateException("Study row " + rs.getString(5)
                            + " does not match its patient and accession (" + link.getStudyId() + ")");
                }
                studies.put(studyCacheKey(link.getRealIdentifier(), link.getStudyKey()), link);
                studiesById.put(link.getStudyId(), link);
            }
        }

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT study_id, series_key FROM admitted_series")) {
            while (rs.next()) {
                admittedSeries.add(seriesCacheKey(rs.getString(1), rs.getString(2)));
            }
        }
    }

    /**
     * Check the audit entries against each other and against the store.
     *
     * @return the entries the audit file should contain, in admission order
     */
    private List<LinkLogEntry> verifyAuditLog(List<LinkLogEntry> entries) {
        Map<String, String> seen = new HashMap<>();
        for (LinkLogEntry entry : entries) {
            String previous = seen.putIfAbsent(entry.getStudyId(), entry.getAccessionNumber());
            if (previous != null && !previous.equals(entry.getAccessionNumber())) {
                throw new InconsistentStateException("Study " + entry.getStudyId()
                        + " is logged with two accession numbers: " + previous + " and " + entry.getAccessionNumber());
            }
            StudyLink stored = studiesById.get(entry.getStudyId());
            if (stored == null) {
                throw new InconsistentStateException("Audit file references study " + entry.getStudyId()
                        + " which the link log store does not contain");
            }
            if (!stored.getAccessionNumber().equals(entry.getAccessionNumber())) {
                throw new InconsistentStateException("Study " + entry.getStudyId() + " has accession "
                        + stored.getAccessionNumber() + " in the store but " + entry.getAccessionNumber()
                        + " in the audit file");
            }
        }

        List<LinkLogEntry> expected = storedEntries();
        if (entries.size() > expected.size()) {
            throw new InconsistentStateException("Audit file has " + entries.size()
                    + " entries but the store only records " + expected.size() + " admitted series");
        }
        return expected;
    }

    private List<LinkLogEntry> storedEntries() {
        List<LinkLogEntry> entries = new ArrayList<>();
        String sql = "SELECT a.study_id, s.accession FROM admitted_series a " +
                "JOIN study s ON s.study_id = a.study_id ORDER BY a.id";
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                entries.add(new LinkLogEntry(rs.getString(1), rs.getString(2)));
            }
        } catch (SQLException e) {
            throw new LinkLogException("Failed to read admitted series: " + e.getMessage(), e);
        }
        return entries;
    }

    @Override
    public Optional<PatientIdentity> lookup(String realIdentifier) {
        return Optional.ofNullable(patients.get(realIdentifier));
    }

    @Override
    public Optional<StudyLink> lookupStudy(String realIdentifier, String studyKey) {
        return Optional.ofNullable(studies.get(studyCacheKey(realIdentifier, studyKey)));
    }

    @Override
    public synchronized PatientIdentity insertIfAbsent(String realIdentifier) {
        ensureOpen();
        PatientIdentity existing = patients.get(realIdentifier);
        if (existing != null) {
            return existing;
        }

        PatientIdentity identity = inTransaction(() -> insertPatient(realIdentifier));
        patients.put(realIdentifier, identity);
        log.debug("Allocated {} for a new patient", identity.getSyntheticIdentifier());
        return identity;
    }

    @Override
    public synchronized StudyLink insertStudyIfAbsent(String realIdentifier, String studyKey) {
        ensureOpen();
        String cacheKey = studyCacheKey(realIdentifier, studyKey);
        StudyLink existing = studies.get(cacheKey);
        if (existing != null) {
            return existing;
        }

        PatientIdentity known = patients.get(realIdentifier);
        PatientIdentity[] created = new PatientIdentity[1];
        StudyLink link = inTransaction(() -> {
            PatientIdentity identity = known;
            if (identity == null) {
                identity = insertPatient(realIdentifier);
                created[0] = identity;
            }
            return insertStudy(identity, studyKey);
        });

        if (created[0] != null) {
            patients.put(realIdentifier, created[0]);
        }
        studies.put(cacheKey, link);
        studiesById.put(link.getStudyId(), link);
        log.debug("Allocated study {}", link.getStudyId());
        return link;
    }

    private PatientIdentity insertPatient(String realIdentifier) throws SQLException {
        long seq = nextCounterValue(PATIENT_COUNTER);
        String syntheticId = String.format("%s%06d", idPrefix, seq);

        String sql = "INSERT INTO patient (real_id, synthetic_id, next_accession, created_at) VALUES (?, ?, 1, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, realIdentifier);
            stmt.setString(2, syntheticId);
            stmt.setString(3, Instant.now().toString());
            stmt.executeUpdate();
        }
        return new PatientIdentity(realIdentifier, syntheticId);
    }

    private StudyLink insertStudy(PatientIdentity identity, String studyKey) throws SQLException {
        long accessionSeq;
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT next_accession FROM patient WHERE real_id = ?")) {
            stmt.setString(1, identity.getRealIdentifier());
            ResultSet rs = stmt.executeQuery();
            if (!rs.next()) {
                throw new InconsistentStateException("Patient " + identity.getSyntheticIdentifier()
                        + " is cached but missing from the store");
            }
            accessionSeq = rs.getLong(1);
        }

        try (PreparedStatement stmt = connection.prepareStatement(
                "UPDATE patient SET next_accession = ? WHERE real_id = ?")) {
            stmt.setLong(1, accessionSeq + 1);
            stmt.setString(2, identity.getRealIdentifier());
            stmt.executeUpdate();
        }

        StudyLink link = new StudyLink(identity.getRealIdentifier(), studyKey,
                identity.getSyntheticIdentifier(), String.format("%04d", accessionSeq));

        String sql = "INSERT INTO study (real_id, study_key, accession_seq, accession, study_id, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, link.getRealIdentifier());
            stmt.setString(2, studyKey);
            stmt.setLong(3, accessionSeq);
            stmt.setString(4, link.getAccessionNumber());
            stmt.setString(5, link.getStudyId());
            stmt.setString(6, Instant.now().toString());
            stmt.executeUpdate();
        }
        return link;
    }

    private long nextCounterValue(String name) throws SQLException {
        long current = 0;
        try (PreparedStatement stmt = connection.prepareStatement("SELECT value FROM counter WHERE name = ?")) {
            stmt.setString(1, name);
            ResultSet rs = stmt.executeQuery();
            if (rs.next()) {
                current = rs.getLong(1);
            }
        }
        long next = current + 1;
        try (PreparedStatement stmt = connection.prepareStatement(
                "INSERT INTO counter (name, value) VALUES (?, ?) " +
                "ON CONFLICT(name) DO UPDATE SET value = excluded.value")) {
            stmt.setString(1, name);
            stmt.setLong(2, next);
            stmt.executeUpdate();
        }
        return next;
    }

    @Override
    public synchronized boolean recordAdmission(String studyId, String seriesKey) {
        ensureOpen();
        String cacheKey = seriesCacheKey(studyId, seriesKey);
        if (admittedSeries.contains(cacheKey)) {
            return false;
        }
        StudyLink link = studiesById.get(studyId);
        if (link == null) {
            throw new IllegalArgumentException("Unknown study: " + studyId);
        }

        String sql = "INSERT INTO admitted_series (study_id, series_key, admitted_at) VALUES (?, ?, ?)";
        inTransaction(() -> {
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.setString(1, studyId);
                stmt.setString(2, seriesKey);
                stmt.setString(3, Instant.now().toString());
                stmt.executeUpdate();
            }
            return null;
        });
        admittedSeries.add(cacheKey);

        try {
            auditLog.append(link.toEntry());
        } catch (IOException e) {
            // Store already committed; the audit file is rebuilt from it on next open
            throw new LinkLogException("Failed to append to " + auditLog.getPath() + ": " + e.getMessage(), e);
        }
        return true;
    }

    @Override
    public String getUidSalt() {
        return uidSalt;
    }

    @Override
    public synchronized LinkLogStats stats() {
        return new LinkLogStats(patients.size(), studies.size(), admittedSeries.size());
    }

    @Override
    public synchronized void flush() {
        ensureOpen();
        rewriteAudit(storedEntries());
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        try {
            flush();
        } finally {
            closed = true;
            release();
            log.info("Link log closed at {}", directory);
        }
    }

    /**
     * Close without rewriting the audit file. Used after a fatal error.
     */
    public synchronized void abandon() {
        if (!closed) {
            closed = true;
            release();
            log.warn("Link log at {} closed without flush", directory);
        }
    }

    private void rewriteAudit(List<LinkLogEntry> entries) {
        try {
            auditLog.rewrite(entries);
        } catch (IOException e) {
            throw new LinkLogException("Failed to rewrite " + auditLog.getPath() + ": " + e.getMessage(), e);
        }
    }

    private void release() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException e) {
            log.error("Error closing link log store: {}", e.getMessage(), e);
        }
        try {
            if (lock != null && lock.isValid()) {
                lock.release();
            }
            if (lockChannel != null) {
                lockChannel.close();
            }
        } catch (IOException e) {
            log.error("Error releasing link log lock: {}", e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Link log is closed");
        }
    }

    private <T> T inTransaction(SqlWork<T> work) {
        try {
            connection.setAutoCommit(false);
            try {
                T result = work.run();
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            if ((e.getErrorCode() & 0xff) == SQLiteErrorCode.SQLITE_CONSTRAINT.code) {
                throw new InconsistentStateException("Link log store already holds a conflicting entry: "
                        + e.getMessage());
            }
            throw new LinkLogException("Link log store write failed: " + e.getMessage(), e);
        }
    }

    private static String studyCacheKey(String realIdentifier, String studyKey) {
        return realIdentifier + '\u0000' + studyKey;
    }

    private static String seriesCacheKey(String studyId, String seriesKey) {
        return studyId + '\u0000' + seriesKey;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }
}
