package com.gocomet.bustracking.flag.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BoardFlagRequest {

    @NotBlank(message = "Student ID is required")
    private String studentId;

    @NotBlank(message = "Bus ID is required")
    private String busId;
}
