package mc.supervisor.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSettingsRequest {
    @Pattern(regexp = "^\\d+[MmGg]$", message = "RAM must look like 1024M or 2G")
    private String minRam;

    @Pattern(regexp = "^\\d+[MmGg]$", message = "RAM must look like 1024M or 2G")
    private String maxRam;

    @Min(value = 1, message = "Max players must be at least 1")
    @Max(value = 1000, message = "Max players cannot exceed 1000")
    private int maxPlayers;

    @Min(value = 1024, message = "Port must be between 1024 and 65535")
    @Max(value = 65535, message = "Port must be between 1024 and 65535")
    private int port;
}
