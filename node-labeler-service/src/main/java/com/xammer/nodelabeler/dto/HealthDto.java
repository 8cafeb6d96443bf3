package com.xammer.nodelabeler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthDto {
    private String status;
    private boolean ready;
    private int recentWatchErrors;
    private Instant lastEvent;
    private int trackedNodes;
}
