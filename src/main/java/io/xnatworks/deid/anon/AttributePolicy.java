/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.anon;

import io.xnatworks.deid.broker.IdentityBundle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single table of retained attributes. Anything not listed is dropped.
 *
 * <p>Output records are secondary captures: identifiers and UIDs come from the
 * link log, dates of birth and study are zeroed, acquisition and pixel attributes
 * are copied.</p>
 */
public final class AttributePolicy {

    public static final String SECONDARY_CAPTURE_SOP_CLASS_UID = "1.2.840.10008.5.1.4.1.1.7";
    public static final String ZERO_DATE = "00000000";
    public static final String ZERO_TIME = "000000";
    public static final String ZERO_BIRTH_TIME = "000000.000000";

    private final Map<String, AttributeRule> rules;

    private AttributePolicy(Map<String, AttributeRule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public Map<String, AttributeRule> getRules() {
        return rules;
    }

    public static AttributePolicy secondaryCapture() {
        Map<String, AttributeRule> r = new LinkedHashMap<>();

        // Identity
        r.put("SOPClassUID", AttributeRule.constant(SECONDARY_CAPTURE_SOP_CLASS_UID));
        r.put("SOPInstanceUID", AttributeRule.identity(IdentityBundle::getSopInstanceUid));
        r.put("StudyInstanceUID", AttributeRule.identity(IdentityBundle::getStudyInstanceUid));
        r.put("SeriesInstanceUID", AttributeRule.identity(IdentityBundle::getSeriesInstanceUid));
        r.put("PatientID", AttributeRule.identity(IdentityBundle::getSyntheticIdentifier));
        r.put("PatientName", AttributeRule.identity(IdentityBundle::getSyntheticIdentifier));
        r.put("AccessionNumber", AttributeRule.identity(IdentityBundle::getAccessionNumber));
        r.put("StudyID", AttributeRule.identity(IdentityBundle::getStudyId));
        r.put("PatientAge", AttributeRule.identity(IdentityBundle::getPatientAge));
        r.put("SecondaryCaptureDeviceManufacturer", AttributeRule.identity(IdentityBundle::getManufacturer));

        // Dates and people
        r.put("StudyDate", AttributeRule.constant(ZERO_DATE));
        r.put("StudyTime", AttributeRule.constant(ZERO_TIME));
        r.put("PatientBirthDate", AttributeRule.constant(ZERO_DATE));
        r.put("PatientBirthTime", AttributeRule.constant(ZERO_BIRTH_TIME));
        r.put("ReferringPhysicianName", AttributeRule.redact());
        r.put("BurnedInAnnotation", AttributeRule.redact());

        // Descriptive
        for (String keyword : new String[]{
                "Modality", "SpecificCharacterSet", "PatientOrientation", "PatientSex",
                "StudyDescription", "SeriesDescription", "ViewPosition", "SeriesNumber", "InstanceNumber"}) {
            r.put(keyword, AttributeRule.copy());
        }

        // Image pixel module
        for (String keyword : new String[]{
                "PlanarConfiguration", "SamplesPerPixel", "PhotometricInterpretation", "PixelRepresentation",
                "HighBit", "BitsStored", "BitsAllocated", "Columns", "Rows", "ImagerPixelSpacing",
                "PresentationLUTShape", "PixelData"}) {
            r.put(keyword, AttributeRule.copy());
        }

        // Acquisition
        for (String keyword : new String[]{
                "KVP", "XRayTubeCurrent", "ExposureTime", "Exposure", "FocalSpots", "AnodeTargetMaterial",
                "BodyPartThickness", "CompressionForce", "PaddleDescription", "ExposureControlMode",
                "DistanceSourceToDetector", "DistanceSourceToPatient", "PositionerPrimaryAngle",
                "PositionerPrimaryAngleDirection", "PositionerSecondaryAngle", "ImageLaterality",
                "BreastImplantPresent", "Manufacturer", "ManufacturerModelName",
                "EstimatedRadiographicMagnificationFactor", "DateOfLastDetectorCalibration"}) {
            r.put(keyword, AttributeRule.copy());
        }

        return new AttributePolicy(r);
    }
}
