package mc.supervisor.service.server;

import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.model.ServerType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

@Component
public class ArtifactProviderRegistry {
    private final Map<ServerType, ArtifactProvider> providers = new EnumMap<>(ServerType.class);

    @Autowired
    public ArtifactProviderRegistry(ArtifactHttpClient http, SupervisorProperties properties) {
        String java = properties.getJavaCommand();
        providers.put(ServerType.PAPER, new PaperArtifactProvider("paper", http));
        providers.put(ServerType.FOLIA, new PaperArtifactProvider("folia", http));
        providers.put(ServerType.VELOCITY, new PaperArtifactProvider("velocity", http));
        providers.put(ServerType.WATERFALL, new PaperArtifactProvider("waterfall", http));
        providers.put(ServerType.PURPUR, new PurpurArtifactProvider(http));
        providers.put(ServerType.FABRIC, new FabricArtifactProvider(http));
        providers.put(ServerType.VANILLA, new VanillaArtifactProvider(http));
        providers.put(ServerType.FORGE, new ForgeArtifactProvider(http, java));
        providers.put(ServerType.NEOFORGE, new NeoForgeArtifactProvider(http, java));
    }

    ArtifactProviderRegistry(Map<ServerType, ArtifactProvider> providers) {
        this.providers.putAll(providers);
    }

    public Optional<ArtifactProvider> find(ServerType type) {
        return Optional.ofNullable(type == null ? null : providers.get(type));
    }
}
