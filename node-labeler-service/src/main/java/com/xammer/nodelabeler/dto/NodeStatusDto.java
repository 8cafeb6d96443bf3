package com.xammer.nodelabeler.dto;

import com.xammer.nodelabeler.domain.ReconcilePhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeStatusDto {
    private String nodeName;
    private String providerId;
    private ReconcilePhase phase;
    private int attempts;          // consecutive failed cycles
    private Instant nextRunAt;
    private Instant lastSuccess;
    private String lastMessage;
}
