package com.gocomet.bustracking.flag.dto;

import lombok.*;

/**
 * {@code updated=false} means the move was below the distance threshold and nothing
 * was written or published.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlagLocationUpdateResponse {

    private boolean updated;
    private double distanceMeters;
    private WaitingFlagResponse flag;
}
