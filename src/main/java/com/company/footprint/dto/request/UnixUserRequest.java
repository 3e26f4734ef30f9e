package com.company.footprint.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnixUserRequest {
    @NotBlank(message = "Login is required")
    private String login;

    private String group;
    private List<String> groups;
}
