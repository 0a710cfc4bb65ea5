package com.gocomet.bustracking.missedbus.dto;

import com.gocomet.bustracking.missedbus.model.MissedBusMessages;
import com.gocomet.bustracking.missedbus.model.MissedBusRequest;
import com.gocomet.bustracking.missedbus.model.MissedBusStatus;
import com.gocomet.bustracking.missedbus.model.RaiseStage;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RaiseMissedBusResponse {

    private RaiseStage stage;
    private UUID requestId;
    private MissedBusStatus status;
    private String message;
    private boolean replayed;
    private UUID existingRequestId;

    public static RaiseMissedBusResponse maintenance() {
        return RaiseMissedBusResponse.builder()
                .stage(RaiseStage.MAINTENANCE)
                .message(MissedBusMessages.MAINTENANCE)
                .build();
    }

    public static RaiseMissedBusResponse rateLimited() {
        return RaiseMissedBusResponse.builder()
                .stage(RaiseStage.RATE_LIMITED)
                .message(MissedBusMessages.RATE_LIMITED)
                .build();
    }

    public static RaiseMissedBusResponse duplicate(MissedBusRequest existing) {
        return RaiseMissedBusResponse.builder()
                .stage(RaiseStage.DUPLICATE)
                .existingRequestId(existing != null ? existing.getId() : null)
                .status(existing != null ? existing.getStatus() : null)
                .message(MissedBusMessages.ALREADY_HAS_PENDING)
                .build();
    }

    public static RaiseMissedBusResponse created(MissedBusRequest request, boolean replayed) {
        return RaiseMissedBusResponse.builder()
                .stage(RaiseStage.CREATED)
                .requestId(request.getId())
                .status(request.getStatus())
                .message(messageFor(request))
                .replayed(replayed)
                .build();
    }

    private static String messageFor(MissedBusRequest request) {
        return switch (request.getStatus()) {
            case PENDING -> MissedBusMessages.REQUEST_PENDING;
            case REJECTED -> MissedBusMessages.NO_CANDIDATES;
            case EXPIRED -> MissedBusMessages.REQUEST_EXPIRED;
            case CANCELLED -> MissedBusMessages.REQUEST_CANCELLED;
            case APPROVED -> request.getResolutionMessage();
        };
    }
}
