/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.deid.broker;

import io.xnatworks.deid.dicom.RecordTags;
import io.xnatworks.deid.linklog.SqliteLinkLog;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IdentityResolver.
 */
@DisplayName("IdentityResolver Tests")
class IdentityResolverTest {

    @TempDir
    Path tempDir;

    private SqliteLinkLog linkLog;
    private IdentityResolver resolver;

    private final Path source = Paths.get("input", "image.json");

    @BeforeEach
    void setUp() {
        linkLog = SqliteLinkLog.open(tempDir.resolve("linklog"));
        resolver = new IdentityResolver(linkLog);
    }

    @AfterEach
    void tearDown() {
        linkLog.close();
    }

    @Nested
    @DisplayName("Identifier Normalization Tests")
    class NormalizationTests {

        @Test
        @DisplayName("Should trim and collapse whitespace")
        void shouldTrimAndCollapse() {
            assertEquals("MRN 123", IdentityResolver.normalizeIdentifier("  MRN   123 "));
        }

        @Test
        @DisplayName("Should reject blank and placeholder identifiers")
        void shouldRejectPlaceholders() {
            assertNull(IdentityResolver.normalizeIdentifier(null));
            assertNull(IdentityResolver.normalizeIdentifier("   "));
            assertNull(IdentityResolver.normalizeIdentifier("UNKNOWN"));
            assertNull(IdentityResolver.normalizeIdentifier("anonymous"));
            assertNull(IdentityResolver.normalizeIdentifier("n/a"));
            assertNull(IdentityResolver.normalizeIdentifier("000000"));
            assertNull(IdentityResolver.normalizeIdentifier("***"));
        }

        @Test
        @DisplayName("Should reject identifiers longer than 64 characters")
        void shouldRejectLongIdentifiers() {
            assertNotNull(IdentityResolver.normalizeIdentifier("A".repeat(64)));
            assertNull(IdentityResolver.normalizeIdentifier("A".repeat(65)));
        }

        @Test
        @DisplayName("Should keep identifiers that merely contain zeros")
        void shouldKeepIdentifiersWithZeros() {
            assertEquals("000123", IdentityResolver.normalizeIdentifier("000123"));
        }
    }

    @Nested
    @DisplayName("Study And Series Key Tests")
    class KeyTests {

        @Test
        @DisplayName("Should prefer study instance UID over accession and date")
        void shouldPreferStudyInstanceUid() {
            RecordTags tags = RecordTags.of(
                    "StudyInstanceUID", "1.2.3",
                    "AccessionNumber", "ACC1",
                    "StudyDate", "20200101");
            assertEquals("uid:1.2.3", IdentityResolver.studyKey(tags));
        }

        @Test
        @DisplayName("Should fall back to accession then date")
        void shouldFallBack() {
            assertEquals("acc:ACC1", IdentityResolver.studyKey(
                    RecordTags.of("AccessionNumber", "ACC1", "StudyDate", "20200101")));
            assertEquals("date:20200101", IdentityResolver.studyKey(
                    RecordTags.of("AccessionNumber", " ", "StudyDate", "20200101")));
            assertEquals("", IdentityResolver.studyKey(RecordTags.of()));
        }

        @Test
        @DisplayName("Should key series by UID or number")
        void shouldKeySeries() {
            assertEquals("uid:1.2.3.4", IdentityResolver.seriesKey(
                    RecordTags.of("SeriesInstanceUID", "1.2.3.4", "SeriesNumber", "2")));
            assertEquals("num:2", IdentityResolver.seriesKey(RecordTags.of("SeriesNumber", "2")));
        }
    }

    @Nested
    @DisplayName("Age Calculation Tests")
    class AgeTests {

        @Test
        @DisplayName("Should compute age in whole years")
        void shouldComputeAge() {
            assertEquals("045Y", IdentityResolver.calculateAge("20200101", "19750101"));
            assertEquals("000Y", IdentityResolver.calculateAge("20200101", "20200101"));
        }

        @Test
        @DisplayName("Should use the absolute difference")
        void shouldUseAbsoluteDifference() {
            assertEquals("010Y", IdentityResolver.calculateAge("20000101", "20100105"));
        }

        @Test
        @DisplayName("Should return blank for missing or invalid dates")
        void shouldReturnBlankForBadDates() {
            assertEquals("", IdentityResolver.calculateAge("20200101", null));
            assertEquals("", IdentityResolver.calculateAge(null, "19750101"));
            assertEquals("", IdentityResolver.calculateAge("2020", "19750101"));
            assertEquals("", IdentityResolver.calculateAge("20201301", "19750101"));
        }
    }

    @Nested
    @DisplayName("Resolution Tests")
    class ResolutionTests {

        private RecordTags image(String series, String instance) {
            return RecordTags.of(
                    "PatientID", "MRN-12345",
                    "StudyInstanceUID", "1.2.840.1",
                    "SeriesInstanceUID", "1.2.840.1." + series,
                    "InstanceNumber", instance,
                    "StudyDate", "20200315",
                    "PatientBirthDate", "19700101");
        }

        @Test
        @DisplayName("Should resolve a record to its synthetic identity")
        void shouldResolve() throws Exception {
            IdentityBundle bundle = resolver.resolve(source, image("1", "1"));

            assertEquals("ANON000001", bundle.getSyntheticIdentifier());
            assertEquals("0001", bundle.getAccessionNumber());
            assertEquals("ANON000001-0001", bundle.getStudyId());
            assertEquals("uid:1.2.840.1.1", bundle.getSeriesKey());
            assertEquals("050Y", bundle.getPatientAge());
            assertEquals(IdentityResolver.SECONDARY_CAPTURE_MANUFACTURER, bundle.getManufacturer());
        }

        @Test
        @DisplayName("Should derive stable UIDs")
        void shouldDeriveStableUids() throws Exception {
            IdentityBundle first = resolver.resolve(source, image("1", "1"));
            IdentityBundle again = resolver.resolve(source, image("1", "1"));

            assertEquals(first.getStudyInstanceUid(), again.getStudyInstanceUid());
            assertEquals(first.getSeriesInstanceUid(), again.getSeriesInstanceUid());
            assertEquals(first.getSopInstanceUid(), again.getSopInstanceUid());
            assertTrue(first.getStudyInstanceUid().startsWith("2.25."));
            assertTrue(first.getStudyInstanceUid().length() <= 64);
            assertNotEquals("1.2.840.1", first.getStudyInstanceUid());
        }

        @Test
        @DisplayName("Should share study UID but not series UID across series")
        void shouldShareStudyUid() throws Exception {
            IdentityBundle a = resolver.resolve(source, image("1", "1"));
            IdentityBundle b = resolver.resolve(source, image("2", "1"));

            assertEquals(a.getStudyId(), b.getStudyId());
            assertEquals(a.getStudyInstanceUid(), b.getStudyInstanceUid());
            assertNotEquals(a.getSeriesInstanceUid(), b.getSeriesInstanceUid());
            assertNotEquals(a.getSopInstanceUid(), b.getSopInstanceUid());
        }

        @Test
        @DisplayName("Should distinguish instances without SOP instance UID")
        void shouldDistinguishInstances() throws Exception {
            IdentityBundle a = resolver.resolve(source, image("1", "1"));
            IdentityBundle b = resolver.resolve(source, image("1", "2"));

            assertNotEquals(a.getSopInstanceUid(), b.getSopInstanceUid());
        }

        @Test
        @DisplayName("Should compute the key without allocating")
        void shouldComputeKeyWithoutAllocating() throws Exception {
            IdentityKey key = resolver.identityKey(source, image("1", "1"));

            assertEquals("MRN-12345", key.getRealIdentifier());
            assertEquals("uid:1.2.840.1", key.getStudyKey());
            assertEquals(0, linkLog.stats().getPatientCount());
        }

        @Test
        @DisplayName("Should leave age blank without a birth date")
        void shouldLeaveAgeBlank() throws Exception {
            RecordTags tags = RecordTags.of("PatientID", "MRN-1", "StudyDate", "20200315");

            assertEquals("", resolver.resolve(source, tags).getPatientAge());
        }

        @Test
        @DisplayName("Should fail without a usable patient identifier")
        void shouldFailWithoutIdentifier() {
            MissingIdentifierException e = assertThrows(MissingIdentifierException.class,
                    () -> resolver.resolve(source, RecordTags.of("PatientID", "UNKNOWN")));
            assertEquals(source, e.getPath());
            assertEquals(0, linkLog.stats().getPatientCount());
        }
    }
}
