/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import static com.ammann.clinicalkpi.support.TimeTestUtils.hours;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class VentilationRecordTest {

    @Test
    void sortsEventsAndDropsMissingInstants() {
        List<Instant> intubations = Arrays.asList(hours(30), null, hours(2));
        VentilationRecord record = new VentilationRecord("a1", intubations, null, null);

        assertThat(record.intubations()).containsExactly(hours(2), hours(30));
        assertThat(record.extubations()).isEmpty();
        assertThat(record.periods()).isEmpty();
    }

    @Test
    void emptyRecordHasNoEvents() {
        VentilationRecord record = VentilationRecord.empty("a1");

        assertThat(record.admissionId()).isEqualTo("a1");
        assertThat(record.intubations()).isEmpty();
        assertThat(record.periods()).isEmpty();
    }
}
