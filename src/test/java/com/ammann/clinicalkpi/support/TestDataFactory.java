/* (C)2026 */
package com.ammann.clinicalkpi.support;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.AntibioticUsagePeriod;
import com.ammann.clinicalkpi.domain.DeviceDayRecord;
import com.ammann.clinicalkpi.domain.DeviceUsage;
import com.ammann.clinicalkpi.domain.LabResult;
import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.domain.SectorStay;
import com.ammann.clinicalkpi.domain.TimePeriod;
import com.ammann.clinicalkpi.domain.VentilationRecord;
import com.ammann.clinicalkpi.enumeration.AdmissionOutcome;
import com.ammann.clinicalkpi.model.AdmissionEntity;
import com.ammann.clinicalkpi.model.DeviceDayEntity;
import com.ammann.clinicalkpi.model.LabResultEntity;
import com.ammann.clinicalkpi.model.SectorStayEntity;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

public final class TestDataFactory {

    public static final String ICU = "ICU-1";
    public static final String WARD = "WARD-3";

    private TestDataFactory() {}

    public static QueryWindow window(Instant start, Instant end) {
        return new QueryWindow(start, end);
    }

    public static Admission ongoing(String admissionId, String patientId, Instant admittedAt) {
        return new Admission(admissionId, patientId, admittedAt, null, null, null);
    }

    public static Admission discharged(
            String admissionId,
            String patientId,
            Instant admittedAt,
            Instant dischargedAt,
            AdmissionOutcome outcome) {
        return new Admission(admissionId, patientId, admittedAt, dischargedAt, outcome, null);
    }

    public static Admission discharged(
            String admissionId,
            String patientId,
            Instant admittedAt,
            Instant dischargedAt,
            AdmissionOutcome outcome,
            String destination) {
        return new Admission(admissionId, patientId, admittedAt, dischargedAt, outcome, destination);
    }

    public static SectorStay stay(String admissionId, String sectorId, Instant start, Instant end) {
        return new SectorStay(admissionId, sectorId, start, end);
    }

    public static VentilationRecord ventilation(
            String admissionId, List<Instant> intubations, List<Instant> extubations, TimePeriod... periods) {
        return new VentilationRecord(admissionId, intubations, extubations, Arrays.asList(periods));
    }

    public static AntibioticUsagePeriod antibiotic(
            String usageId, String admissionId, String name, TimePeriod... periods) {
        return new AntibioticUsagePeriod(usageId, admissionId, name, Arrays.asList(periods));
    }

    public static TimePeriod period(Instant start, Instant end) {
        return new TimePeriod(start, end);
    }

    public static DeviceDayRecord deviceDay(
            String admissionId,
            LocalDate day,
            boolean centralLine,
            boolean urinaryCatheter,
            boolean arterialLine,
            boolean ventilated) {
        return new DeviceDayRecord(
                admissionId, ICU, day, centralLine, urinaryCatheter, arterialLine, ventilated);
    }

    public static DeviceUsage deviceUsage(String admissionId, String rawType, Instant start, Instant end) {
        return new DeviceUsage(admissionId, rawType, start, end, end != null ? "removal" : null);
    }

    public static LabResult lab(String admissionId, String testName, Instant takenAt, Double value) {
        return new LabResult(admissionId, testName, takenAt, value, null);
    }

    public static AdmissionEntity createAdmission(
            String admissionId, String patientId, Instant admittedAt, Instant dischargedAt) {
        AdmissionEntity entity = new AdmissionEntity();
        entity.admissionId = admissionId;
        entity.patientId = patientId;
        entity.admittedAt = admittedAt;
        entity.dischargedAt = dischargedAt;
        entity.outcome = dischargedAt != null ? AdmissionOutcome.DISCHARGED_ALIVE.getSourceCode() : null;
        return entity;
    }

    public static SectorStayEntity createStay(String admissionId, String sectorId, Instant start, Instant end) {
        SectorStayEntity entity = new SectorStayEntity();
        entity.admissionId = admissionId;
        entity.sectorId = sectorId;
        entity.startAt = start;
        entity.endAt = end;
        return entity;
    }

    public static LabResultEntity createLabResult(
            String admissionId, String testName, Instant takenAt, double value) {
        LabResultEntity entity = new LabResultEntity();
        entity.admissionId = admissionId;
        entity.testName = testName;
        entity.takenAt = takenAt;
        entity.value = value;
        entity.unit = "mg/dL";
        return entity;
    }

    public static DeviceDayEntity createDeviceDay(
            String admissionId, String sectorId, LocalDate day, boolean centralLine) {
        DeviceDayEntity entity = new DeviceDayEntity();
        entity.admissionId = admissionId;
        entity.sectorId = sectorId;
        entity.day = day;
        entity.centralLine = centralLine;
        return entity;
    }
}
