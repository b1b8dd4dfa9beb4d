package mc.supervisor.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateInstanceRequest {
    @NotBlank(message = "Name cannot be empty")
    @Size(max = 64, message = "Name cannot exceed 64 characters")
    private String name;

    @NotBlank(message = "Server type is required")
    private String type;

    @Builder.Default
    private String version = "latest";

    @Min(value = 1024, message = "Port must be between 1024 and 65535")
    @Max(value = 65535, message = "Port must be between 1024 and 65535")
    private int port;

    @Builder.Default
    @Pattern(regexp = "^\\d+[MmGg]$", message = "RAM must look like 1024M or 2G")
    private String minRam = "1G";

    @Builder.Default
    @Pattern(regexp = "^\\d+[MmGg]$", message = "RAM must look like 1024M or 2G")
    private String maxRam = "2G";

    @Builder.Default
    @Min(value = 1, message = "Max players must be at least 1")
    @Max(value = 1000, message = "Max players cannot exceed 1000")
    private int maxPlayers = 20;

    private String flags;

    private boolean alwaysPreTouch;
}
