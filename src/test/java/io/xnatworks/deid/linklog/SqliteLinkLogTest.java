/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.deid.linklog;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SqliteLinkLog.
 */
@DisplayName("SqliteLinkLog Tests")
class SqliteLinkLogTest {

    @TempDir
    Path tempDir;

    private Path auditFile() {
        return tempDir.resolve(SqliteLinkLog.AUDIT_FILE);
    }

    private String auditContent() throws IOException {
        return Files.readString(auditFile(), StandardCharsets.UTF_8);
    }

    private void appendToAudit(String text) throws IOException {
        Files.writeString(auditFile(), text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Nested
    @DisplayName("Allocation Tests")
    class AllocationTests {

        @Test
        @DisplayName("Should allocate prefixed six digit identifiers")
        void shouldAllocatePrefixedIdentifiers() {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                PatientIdentity identity = linkLog.insertIfAbsent("MRN-12345");

                assertEquals("MRN-12345", identity.getRealIdentifier());
                assertEquals("ANON000001", identity.getSyntheticIdentifier());
            }
        }

        @Test
        @DisplayName("Should return the same identity for the same identifier")
        void shouldBeIdempotent() {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                PatientIdentity first = linkLog.insertIfAbsent("MRN-1");
                PatientIdentity second = linkLog.insertIfAbsent("MRN-1");

                assertEquals(first, second);
                assertEquals(1, linkLog.stats().getPatientCount());
            }
        }

        @Test
        @DisplayName("Should allocate distinct identities for distinct identifiers")
        void shouldAllocateDistinctIdentities() {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                PatientIdentity a = linkLog.insertIfAbsent("MRN-1");
                PatientIdentity b = linkLog.insertIfAbsent("MRN-2");

                assertEquals("ANON000001", a.getSyntheticIdentifier());
                assertEquals("ANON000002", b.getSyntheticIdentifier());
            }
        }

        @Test
        @DisplayName("Should use a custom identifier prefix")
        void shouldUseCustomPrefix() {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir, "SUBJ")) {
                assertEquals("SUBJ000001", linkLog.insertIfAbsent("MRN-1").getSyntheticIdentifier());
            }
        }

        @Test
        @DisplayName("Should number accessions per patient")
        void shouldNumberAccessionsPerPatient() {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                StudyLink first = linkLog.insertStudyIfAbsent("MRN-1", "uid:1.2.3");
                StudyLink second = linkLog.insertStudyIfAbsent("MRN-1", "uid:1.2.4");
                StudyLink other = linkLog.insertStudyIfAbsent("MRN-2", "uid:9.9.9");

                assertEquals("0001", first.getAccessionNumber());
                assertEquals("ANON000001-0001", first.getStudyId());
                assertEquals("0002", second.getAccessionNumber());
                assertEquals("ANON000001-0002", second.getStudyId());
                assertEquals("ANON000002-0001", other.getStudyId());
            }
        }

        @Test
        @DisplayName("Should look up without allocating")
        void shouldLookUpWithoutAllocating() {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                assertTrue(linkLog.lookup("MRN-1").isEmpty());
                assertTrue(linkLog.lookupStudy("MRN-1", "uid:1").isEmpty());
                assertEquals(0, linkLog.stats().getPatientCount());

                StudyLink link = linkLog.resolve("MRN-1", "uid:1");

                assertEquals(link, linkLog.lookupStudy("MRN-1", "uid:1").orElseThrow());
                assertEquals("ANON000001", linkLog.lookup("MRN-1").orElseThrow().getSyntheticIdentifier());
            }
        }

        @Test
        @DisplayName("Should hand out one identity under concurrent resolution")
        void shouldResolveConcurrently() throws Exception {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                ExecutorService executor = Executors.newFixedThreadPool(8);
                CountDownLatch start = new CountDownLatch(1);
                Set<String> studyIds = ConcurrentHashMap.newKeySet();
                List<Future<?>> futures = new ArrayList<>();

                for (int t = 0; t < 8; t++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < 20; i++) {
                            studyIds.add(linkLog.resolve("MRN-" + i, "uid:study").getStudyId());
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
                executor.shutdown();

                assertEquals(20, studyIds.size());
                assertEquals(20, linkLog.stats().getPatientCount());
                assertEquals(20, linkLog.stats().getStudyCount());
            }
        }

        @Test
        @DisplayName("Should reject writes after close")
        void shouldRejectWritesAfterClose() {
            SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir);
            linkLog.close();

            assertThrows(IllegalStateException.class, () -> linkLog.insertIfAbsent("MRN-1"));
        }
    }

    @Nested
    @DisplayName("Persistence Tests")
    class PersistenceTests {

        @Test
        @DisplayName("Should keep mappings across reopen")
        void shouldKeepMappingsAcrossReopen() {
            StudyLink original;
            String salt;
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                linkLog.insertIfAbsent("MRN-0");
                original = linkLog.resolve("MRN-1", "uid:1.2.3");
                salt = linkLog.getUidSalt();
            }

            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                assertEquals(original, linkLog.resolve("MRN-1", "uid:1.2.3"));
                assertEquals(salt, linkLog.getUidSalt());
                assertEquals("ANON000003", linkLog.insertIfAbsent("MRN-3").getSyntheticIdentifier());
            }
        }

        @Test
        @DisplayName("Should refuse a second open of the same directory")
        void shouldRefuseSecondOpen() {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                assertThrows(LinkLogException.class, () -> SqliteLinkLog.open(tempDir));
            }
        }

        @Test
        @DisplayName("Should report a corrupt store")
        void shouldReportCorruptStore() throws IOException {
            Files.createDirectories(tempDir);
            Files.writeString(tempDir.resolve(SqliteLinkLog.DB_FILE), "not a database ".repeat(100));

            assertThrows(CorruptLogException.class, () -> SqliteLinkLog.open(tempDir));
        }
    }

    @Nested
    @DisplayName("Audit File Tests")
    class AuditFileTests {

        @Test
        @DisplayName("Should append one line per admitted series")
        void shouldAppendOncePerSeries() throws IOException {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                StudyLink link = linkLog.resolve("MRN-12345", "uid:1.2.3");

                assertTrue(linkLog.recordAdmission(link.getStudyId(), "uid:series-1"));
                assertFalse(linkLog.recordAdmission(link.getStudyId(), "uid:series-1"));
                assertTrue(linkLog.recordAdmission(link.getStudyId(), "uid:series-2"));

                assertEquals("ANON000001-0001\t0001\nANON000001-0001\t0001\n", auditContent());
                assertEquals(2, linkLog.stats().getAdmittedSeriesCount());
            }
        }

        @Test
        @DisplayName("Should not log studies that were never admitted")
        void shouldNotLogUnadmittedStudies() {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                linkLog.resolve("MRN-1", "uid:1");
            }
            assertFalse(Files.exists(auditFile()) && auditFile().toFile().length() > 0);
        }

        @Test
        @DisplayName("Should reject admission of an unknown study")
        void shouldRejectUnknownStudy() {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                assertThrows(IllegalArgumentException.class,
                        () -> linkLog.recordAdmission("ANON000099-0001", "uid:1"));
            }
        }

        @Test
        @DisplayName("Should drop a torn final line on reopen")
        void shouldDropTornTail() throws IOException {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                StudyLink link = linkLog.resolve("MRN-1", "uid:1");
                linkLog.recordAdmission(link.getStudyId(), "uid:s1");
            }
            appendToAudit("ANON000001-00");

            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                assertEquals("ANON000001-0001\t0001\n", auditContent());
                assertEquals(1, linkLog.stats().getAdmittedSeriesCount());
            }
        }

        @Test
        @DisplayName("Should rebuild a missing audit file from the store")
        void shouldRebuildMissingAuditFile() throws IOException {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                StudyLink link = linkLog.resolve("MRN-1", "uid:1");
                linkLog.recordAdmission(link.getStudyId(), "uid:s1");
            }
            Files.delete(auditFile());

            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                assertEquals("ANON000001-0001\t0001\n", auditContent());
            }
        }

        @Test
        @DisplayName("Should fail on a malformed line")
        void shouldFailOnMalformedLine() throws IOException {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                StudyLink link = linkLog.resolve("MRN-1", "uid:1");
                linkLog.recordAdmission(link.getStudyId(), "uid:s1");
            }
            appendToAudit("garbage line\n");

            CorruptLogException e = assertThrows(CorruptLogException.class, () -> SqliteLinkLog.open(tempDir));
            assertTrue(e.getMessage().contains("line 2"));
        }

        @Test
        @DisplayName("Should fail when a study is logged with two accessions")
        void shouldFailOnConflictingAccessions() throws IOException {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                StudyLink link = linkLog.resolve("MRN-1", "uid:1");
                linkLog.recordAdmission(link.getStudyId(), "uid:s1");
            }
            appendToAudit("ANON000001-0001\t0002\n");

            assertThrows(InconsistentStateException.class, () -> SqliteLinkLog.open(tempDir));
        }

        @Test
        @DisplayName("Should fail when the audit file references an unknown study")
        void shouldFailOnUnknownStudy() throws IOException {
            Files.createDirectories(tempDir);
            appendToAudit("ANON000009-0001\t0001\n");

            assertThrows(InconsistentStateException.class, () -> SqliteLinkLog.open(tempDir));
        }

        @Test
        @DisplayName("Should fail when the audit file is ahead of the store")
        void shouldFailWhenAuditIsAhead() throws IOException {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                StudyLink link = linkLog.resolve("MRN-1", "uid:1");
                linkLog.recordAdmission(link.getStudyId(), "uid:s1");
            }
            appendToAudit("ANON000001-0001\t0001\n");

            assertThrows(InconsistentStateException.class, () -> SqliteLinkLog.open(tempDir));
        }

        @Test
        @DisplayName("Should keep every logged study distinct per accession")
        void shouldKeepStudiesDistinct() throws IOException {
            try (SqliteLinkLog linkLog = SqliteLinkLog.open(tempDir)) {
                for (int i = 0; i < 5; i++) {
                    StudyLink link = linkLog.resolve("MRN-" + i, "uid:study");
                    linkLog.recordAdmission(link.getStudyId(), "uid:series");
                }
            }

            Set<String> studyIds = new HashSet<>();
            for (String line : Files.readAllLines(auditFile())) {
                String[] fields = line.split("\t");
                assertEquals(2, fields.length);
                assertTrue(fields[0].endsWith("-" + fields[1]));
                studyIds.add(fields[0]);
            }
            assertEquals(5, studyIds.size());
        }
    }
}
