package mc.supervisor.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CloneInstanceRequest {
    @NotBlank(message = "Name cannot be empty")
    @Size(max = 64, message = "Name cannot exceed 64 characters")
    private String name;

    @Min(value = 1024, message = "Port must be between 1024 and 65535")
    @Max(value = 65535, message = "Port must be between 1024 and 65535")
    private int port;

    private boolean copyPlugins;

    private boolean copyWorlds;

    private boolean copyConfig;
}
