/* (C)2026 */
package com.ammann.clinicalkpi.persistence;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.AntibioticUsagePeriod;
import com.ammann.clinicalkpi.domain.DeviceDayAggregate;
import com.ammann.clinicalkpi.domain.DeviceUsage;
import com.ammann.clinicalkpi.domain.LabResult;
import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.domain.SectorStay;
import com.ammann.clinicalkpi.domain.TimePeriod;
import com.ammann.clinicalkpi.domain.VentilationRecord;
import com.ammann.clinicalkpi.enumeration.VentilationEventType;
import com.ammann.clinicalkpi.exception.StorageException;
import com.ammann.clinicalkpi.model.AdmissionEntity;
import com.ammann.clinicalkpi.model.AntibioticPeriodEntity;
import com.ammann.clinicalkpi.model.AntibioticUsageEntity;
import com.ammann.clinicalkpi.model.DeviceDayEntity;
import com.ammann.clinicalkpi.model.DeviceUsageEntity;
import com.ammann.clinicalkpi.model.KpiSnapshotEntity;
import com.ammann.clinicalkpi.model.LabResultEntity;
import com.ammann.clinicalkpi.model.SectorStayEntity;
import com.ammann.clinicalkpi.model.VentilationEventEntity;
import com.ammann.clinicalkpi.model.VentilationPeriodEntity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * {@link ClinicalRecordStore} backed by Hibernate ORM with Panache on PostgreSQL.
 *
 * <p>Every query is wrapped so that a {@link PersistenceException} surfaces as a
 * {@link StorageException}.
 */
@ApplicationScoped
public class PanacheClinicalRecordStore implements ClinicalRecordStore {

    private static final Logger LOG = Logger.getLogger(PanacheClinicalRecordStore.class);

    @Override
    public List<Admission> fetchAdmissionsDischargedIn(QueryWindow window) {
        return query("admissions discharged in window", () ->
                AdmissionEntity.findDischargedBetween(window.start(), window.end()).stream()
                        .map(AdmissionEntity::toDomain)
                        .toList());
    }

    @Override
    public List<SectorStay> fetchSectorStaysOverlapping(String sectorId, QueryWindow window) {
        return query("sector stays overlapping window", () ->
                SectorStayEntity.findOverlapping(sectorId, window.start(), window.end()).stream()
                        .map(SectorStayEntity::toDomain)
                        .toList());
    }

    @Override
    public List<SectorStay> fetchSectorStaysFor(String sectorId, Collection<String> admissionIds) {
        if (admissionIds == null || admissionIds.isEmpty()) {
            return List.of();
        }
        return query("sector stays of admissions", () ->
                SectorStayEntity.findBySectorAndAdmissions(sectorId, admissionIds).stream()
                        .map(SectorStayEntity::toDomain)
                        .toList());
    }

    @Override
    public List<Admission> fetchAdmissions(Collection<String> admissionIds) {
        if (admissionIds == null || admissionIds.isEmpty()) {
            return List.of();
        }
        return query("admissions by id", () ->
                AdmissionEntity.findByAdmissionIds(admissionIds).stream()
                        .map(AdmissionEntity::toDomain)
                        .toList());
    }

    @Override
    public List<Admission> fetchAdmissionsOfPatients(Collection<String> patientIds) {
        if (patientIds == null || patientIds.isEmpty()) {
            return List.of();
        }
        return query("admissions of patients", () ->
                AdmissionEntity.findByPatientIds(patientIds).stream()
                        .map(AdmissionEntity::toDomain)
                        .toList());
    }

    @Override
    public List<VentilationRecord> fetchVentilationRecords(Collection<String> admissionIds) {
        if (admissionIds == null || admissionIds.isEmpty()) {
            return List.of();
        }
        return query("ventilation records", () -> {
            Map<String, List<VentilationEventEntity>> events =
                    VentilationEventEntity.findByAdmissionIds(admissionIds).stream()
                            .collect(Collectors.groupingBy(e -> e.admissionId, TreeMap::new, Collectors.toList()));
            Map<String, List<VentilationPeriodEntity>> periods =
                    VentilationPeriodEntity.findByAdmissionIds(admissionIds).stream()
                            .collect(Collectors.groupingBy(p -> p.admissionId, TreeMap::new, Collectors.toList()));

            Set<String> ventilated = new TreeSet<>(events.keySet());
            ventilated.addAll(periods.keySet());

            List<VentilationRecord> records = new ArrayList<>(ventilated.size());
            for (String admissionId : ventilated) {
                List<VentilationEventEntity> admissionEvents = events.getOrDefault(admissionId, List.of());
                records.add(new VentilationRecord(
                        admissionId,
                        instantsOf(admissionEvents, VentilationEventType.INTUBATION),
                        instantsOf(admissionEvents, VentilationEventType.EXTUBATION),
                        periods.getOrDefault(admissionId, List.of()).stream()
                                .map(VentilationPeriodEntity::toDomain)
                                .toList()));
            }
            return records;
        });
    }

    @Override
    public DeviceDayAggregate fetchDeviceDayAggregate(String sectorId, QueryWindow window) {
        LocalDate fromDay = firstDayAtOrAfter(window.start());
        LocalDate toDay = firstDayAtOrAfter(window.end());
        if (!fromDay.isBefore(toDay)) {
            return DeviceDayAggregate.EMPTY;
        }
        return query("device-day rows", () ->
                DeviceDayAggregate.of(DeviceDayEntity.findInSector(sectorId, fromDay, toDay).stream()
                        .map(DeviceDayEntity::toDomain)
                        .toList()));
    }

    @Override
    public List<AntibioticUsagePeriod> fetchAntibioticUsage(Collection<String> admissionIds) {
        if (admissionIds == null || admissionIds.isEmpty()) {
            return List.of();
        }
        return query("antibiotic usage", () -> {
            List<AntibioticUsageEntity> usages = AntibioticUsageEntity.findByAdmissionIds(admissionIds);
            if (usages.isEmpty()) {
                return List.<AntibioticUsagePeriod>of();
            }
            Map<Long, List<TimePeriod>> periodsByUsage =
                    AntibioticPeriodEntity.findByUsageIds(usages.stream().map(u -> u.id).toList()).stream()
                            .collect(Collectors.groupingBy(
                                    p -> p.usageId,
                                    Collectors.mapping(AntibioticPeriodEntity::toDomain, Collectors.toList())));

            return usages.stream()
                    .map(u -> new AntibioticUsagePeriod(
                            String.valueOf(u.id),
                            u.admissionId,
                            u.antibioticName,
                            periodsByUsage.getOrDefault(u.id, List.of())))
                    .toList();
        });
    }

    @Override
    public Optional<Admission> fetchAdmission(String admissionId) {
        if (admissionId == null || admissionId.isBlank()) {
            return Optional.empty();
        }
        return query("admission " + admissionId, () ->
                AdmissionEntity.findByAdmissionId(admissionId).map(AdmissionEntity::toDomain));
    }

    @Override
    public List<DeviceUsage> fetchDeviceUsage(String admissionId) {
        return query("device usage", () ->
                DeviceUsageEntity.findByAdmissionId(admissionId).stream()
                        .map(DeviceUsageEntity::toDomain)
                        .toList());
    }

    @Override
    public List<LabResult> fetchLabResults(String admissionId, Collection<String> testCodes) {
        if (testCodes == null || testCodes.isEmpty()) {
            return List.of();
        }
        List<String> codes = testCodes.stream()
                .map(code -> code.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        return query("lab results", () ->
                LabResultEntity.findForAdmission(admissionId, codes).stream()
                        .map(LabResultEntity::toDomain)
                        .toList());
    }

    @Override
    public boolean hasStayInSector(String admissionId, String sectorId) {
        if (sectorId == null || sectorId.isBlank()) {
            return false;
        }
        return query("sector stay lookup", () -> SectorStayEntity.existsFor(admissionId, sectorId));
    }

    @Override
    public List<String> fetchSectorIds() {
        return query("sector ids", SectorStayEntity::findDistinctSectorIds);
    }

    @Override
    public List<SectorStay> fetchOpenSectorStays(String sectorId) {
        return query("open sector stays", () ->
                SectorStayEntity.findOpenInSector(sectorId).stream()
                        .map(SectorStayEntity::toDomain)
                        .toList());
    }

    @Override
    public long countAdmissions() {
        return query("admission count", AdmissionEntity::count);
    }

    @Override
    @Transactional
    public boolean upsertSnapshot(String sectorId, QueryWindow window, Instant computedAt, String documentJson) {
        return query("snapshot upsert", () -> {
            Object inserted = KpiSnapshotEntity.getEntityManager()
                    .createNativeQuery(KpiSnapshotEntity.UPSERT_SQL)
                    .setParameter(1, sectorId)
                    .setParameter(2, window.start())
                    .setParameter(3, window.end())
                    .setParameter(4, computedAt)
                    .setParameter(5, documentJson)
                    .getSingleResult();
            return Boolean.TRUE.equals(inserted);
        });
    }

    private static List<Instant> instantsOf(List<VentilationEventEntity> events, VentilationEventType type) {
        return events.stream()
                .filter(e -> e.eventType == type)
                .map(e -> e.occurredAt)
                .toList();
    }

    /**
     * Census days are dated at UTC midnight; a day belongs to the window when its
     * midnight lies in {@code [start, end)}.
     */
    static LocalDate firstDayAtOrAfter(Instant instant) {
        LocalDate day = LocalDate.ofInstant(instant, ZoneOffset.UTC);
        if (day.atTime(LocalTime.MIDNIGHT).toInstant(ZoneOffset.UTC).equals(instant)) {
            return day;
        }
        return day.plusDays(1);
    }

    private static <T> T query(String what, Supplier<T> action) {
        try {
            return action.get();
        } catch (PersistenceException e) {
            LOG.errorf(e, "Failed to load %s", what);
            throw new StorageException("Clinical record store unavailable while loading " + what, e);
        }
    }
}
