package com.purchasingpower.blamelens.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class BlameProperties {

    @NotBlank
    private String gitExecutable = "git";

    @Min(1)
    private long timeoutSeconds = 10;
}
