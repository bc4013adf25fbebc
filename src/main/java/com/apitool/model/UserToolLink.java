package com.apitool.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Remembers that a caller has used a tool, together with the last known status of that usage.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserToolLink {

    private String userId;

    private String organizationId;

    private String toolId;

    private UserToolStatus status;

    private Instant createdAt;

    private Instant updatedAt;
}
