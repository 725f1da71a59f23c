package com.server.skillsync.match.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StatusUpdateRequest {
    // pending / viewed / interested / applied / rejected
    @NotBlank(message = "状态不能为空")
    private String status;
}
