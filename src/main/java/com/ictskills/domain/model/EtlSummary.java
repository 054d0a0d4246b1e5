package com.ictskills.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EtlSummary {

    int rowsRead;
    int recordsReshaped;
    int recordsUpserted;
}
