/* (C)2026 */
package com.ammann.clinicalkpi.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.clinicalkpi.dto.AdmittedPatientsDTO;
import com.ammann.clinicalkpi.dto.SectorListDTO;
import com.ammann.clinicalkpi.service.SectorDirectoryService;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SectorResourceTest {

    private SectorDirectoryService directory;
    private SectorResource resource;

    @BeforeEach
    void setUp() {
        directory = mock(SectorDirectoryService.class);
        resource = new SectorResource();
        resource.sectorDirectoryService = directory;
    }

    @Test
    void listsSectors() {
        SectorListDTO sectors = new SectorListDTO(List.of("ICU-1"));
        when(directory.listSectors()).thenReturn(sectors);

        Response response = resource.listSectors();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isEqualTo(sectors);
    }

    @Test
    void listsAdmittedPatientsOfSector() {
        AdmittedPatientsDTO admitted = new AdmittedPatientsDTO("ICU-1", List.of());
        when(directory.listAdmitted("ICU-1")).thenReturn(admitted);

        Response response = resource.listAdmitted("ICU-1");

        assertThat(response.getEntity()).isEqualTo(admitted);
    }
}
