package com.ictskills.domain.model;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EtlRunRequest {

    // Relative to the ETL data directory; blank means the configured survey file
    @Size(max = 500)
    private String sourcePath;
}
