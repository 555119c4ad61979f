package com.watchtide.dto;

import com.watchtide.model.WatchProvider;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WatchStartRequest {

    @NotNull(message = "provider is required")
    private WatchProvider provider;

    @NotBlank(message = "resourceKey is required")
    private String resourceKey;
}
