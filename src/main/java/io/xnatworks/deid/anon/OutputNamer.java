/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.anon;

import java.nio.file.Path;

/**
 * Deterministic output location for a transformed record:
 * {@code studyID_seriesNumber_instanceNumber_modality_studyDescription_seriesDescription_viewPosition<ext>},
 * optionally inside a per-study or per-patient folder.
 */
public class OutputNamer {
    private static final String REMOVED_CHARS = "/\\()^[];:";

    private final Path outputDir;
    private final GroupingMode grouping;
    private final String extension;

    public OutputNamer(Path outputDir, GroupingMode grouping, String extension) {
        this.outputDir = outputDir;
        this.grouping = grouping;
        this.extension = extension;
    }

    public String fileName(TransformedRecord record) {
        String name = String.join("_",
                record.getIdentity().getStudyId(),
                record.get("SeriesNumber"),
                record.get("InstanceNumber"),
                record.get("Modality"),
                record.get("StudyDescription"),
                record.get("SeriesDescription"),
                record.get("ViewPosition"));
        return cleanString(name) + extension;
    }

    public Path targetPath(TransformedRecord record) {
        String fileName = fileName(record);
        switch (grouping) {
            case STUDY:
                return outputDir.resolve(cleanString(record.getIdentity().getStudyId())).resolve(fileName);
            case PATIENT:
                return outputDir.resolve(cleanString(record.getIdentity().getSyntheticIdentifier())).resolve(fileName);
            case NONE:
            default:
                return outputDir.resolve(fileName);
        }
    }

    /**
     * Strip path and DICOM delimiter characters and turn spaces into dashes.
     */
    static String cleanString(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (REMOVED_CHARS.indexOf(c) >= 0) {
                continue;
            }
            sb.append(c == ' ' ? '-' : c);
        }
        return sb.toString();
    }
}
