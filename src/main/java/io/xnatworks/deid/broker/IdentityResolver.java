/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.broker;

import io.xnatworks.deid.dicom.RecordTags;
import io.xnatworks.deid.linklog.LinkLog;
import io.xnatworks.deid.linklog.StudyLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Turns the identity-bearing attributes of a record into a resolved identity.
 *
 * <p>The real patient identifier is normalized (trimmed, inner whitespace
 * collapsed, placeholders such as "UNKNOWN" rejected) and scoped to a study by
 * the first present of StudyInstanceUID, AccessionNumber and StudyDate. The
 * pair is resolved through the {@link LinkLog}, which is the only place new
 * synthetic values are allocated.</p>
 *
 * <p>Replacement UIDs are name-based on the link log's salt, so they stay the
 * same every time the same record is processed against the same link log.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    public static final String SECONDARY_CAPTURE_MANUFACTURER = "XNATWorks DICOM De-identifier";
    public static final int MAX_IDENTIFIER_LENGTH = 64;

    private static final List<String> PLACEHOLDERS = Arrays.asList(
            "UNKNOWN", "NONE", "NULL", "N/A", "NA", "ANONYMOUS"
    );
    private static final String UID_ROOT = "2.25.";

    private final LinkLog linkLog;

    public IdentityResolver(LinkLog linkLog) {
        this.linkLog = linkLog;
    }

    /**
     * Compute the normalized identifier and study key without touching the link log.
     *
     * @throws MissingIdentifierException if the record has no usable PatientID
     */
    public IdentityKey identityKey(Path path, RecordTags tags) throws MissingIdentifierException {
        String realIdentifier = normalizeIdentifier(tags.get("PatientID").orElse(null));
        if (realIdentifier == null) {
            throw new MissingIdentifierException(path, "No usable PatientID in " + path);
        }
        return new IdentityKey(realIdentifier, studyKey(tags));
    }

    /**
     * Resolve the full identity bundle of a record, allocating in the link log if
     * the identifier or study has not been seen before.
     *
     * @throws MissingIdentifierException if the record has no usable PatientID
     */
    public IdentityBundle resolve(Path path, RecordTags tags) throws MissingIdentifierException {
        IdentityKey key = identityKey(path, tags);
        StudyLink link = linkLog.resolve(key.getRealIdentifier(), key.getStudyKey());

        String seriesKey = seriesKey(tags);
        String sopSource = tags.getNonBlank("SOPInstanceUID")
                .orElse(seriesKey + "/" + tags.getNonBlank("InstanceNumber").orElse(""));

        return new IdentityBundle(
                link,
                seriesKey,
                deriveUid("study", link.getStudyId()),
                deriveUid("series", link.getStudyId(), seriesKey),
                deriveUid("sop", link.getStudyId(), sopSource),
                calculateAge(tags.getNonBlank("StudyDate").orElse(null),
                        tags.getNonBlank("PatientBirthDate").orElse(null)),
                SECONDARY_CAPTURE_MANUFACTURER
        );
    }

    /**
     * Normalize a raw identifier.
     *
     * @return the normalized identifier, or null if it is not usable
     */
    static String normalizeIdentifier(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().replaceAll("\\s+", " ");
        if (normalized.isEmpty() || normalized.length() > MAX_IDENTIFIER_LENGTH) {
            return null;
        }
        if (PLACEHOLDERS.contains(normalized.toUpperCase(Locale.ROOT))) {
            return null;
        }
        if (normalized.chars().allMatch(c -> c == '0' || c == '*' || c == '-')) {
            return null;
        }
        return normalized;
    }

    static String studyKey(RecordTags tags) {
        if (tags.getNonBlank("StudyInstanceUID").isPresent()) {
            return "uid:" + tags.getNonBlank("StudyInstanceUID").get();
        }
        if (tags.getNonBlank("AccessionNumber").isPresent()) {
            return "acc:" + tags.getNonBlank("AccessionNumber").get();
        }
        if (tags.getNonBlank("StudyDate").isPresent()) {
            return "date:" + tags.getNonBlank("StudyDate").get();
        }
        return "";
    }

    static String seriesKey(RecordTags tags) {
        if (tags.getNonBlank("SeriesInstanceUID").isPresent()) {
            return "uid:" + tags.getNonBlank("SeriesInstanceUID").get();
        }
        return "num:" + tags.getNonBlank("SeriesNumber").orElse("");
    }

    /**
     * Age at study time as a DICOM age string ("045Y").
     *
     * @return the age, or "" if either date is missing or not in YYYYMMDD form
     */
    static String calculateAge(String studyDate, String birthDate) {
        if (studyDate == null || birthDate == null) {
            return "";
        }
        try {
            LocalDate study = LocalDate.parse(studyDate, DateTimeFormatter.BASIC_ISO_DATE);
            LocalDate birth = LocalDate.parse(birthDate, DateTimeFormatter.BASIC_ISO_DATE);
            long years = Math.abs(ChronoUnit.DAYS.between(birth, study)) / 365;
            return String.format("%03dY", years);
        } catch (DateTimeParseException e) {
            log.debug("Cannot compute age from study date '{}' and birth date '{}'", studyDate, birthDate);
            return "";
        }
    }

    String deriveUid(String... parts) {
        String name = linkLog.getUidSalt() + "|" + String.join("|", parts);
        UUID uuid = UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
        ByteBuffer buffer = ByteBuffer.allocate(16);
        buffer.putLong(uuid.getMostSignificantBits());
        buffer.putLong(uuid.getLeastSignificantBits());
        return UID_ROOT + new BigInteger(1, buffer.array());
    }
}
