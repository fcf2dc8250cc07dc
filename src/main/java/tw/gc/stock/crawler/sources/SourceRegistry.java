package tw.gc.stock.crawler.sources;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import tw.gc.stock.crawler.config.CrawlerProperties;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of source adapters by name.
 *
 * <p>Adapters declared as beans win over bridge sources configured under
 * {@code crawler.bridge.sources} with the same name.</p>
 */
@Component
@Slf4j
public class SourceRegistry {

    private final Map<String, SourceAdapter> adapters = new LinkedHashMap<>();

    public SourceRegistry(ObjectProvider<SourceAdapter> beans,
                          CrawlerProperties properties,
                          RestTemplate restTemplate,
                          ObjectMapper objectMapper,
                          @Value("${bridge.url:http://localhost:8888}") String bridgeUrl) {
        beans.orderedStream().forEach(this::register);

        ObjectMapper bridgeMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        properties.getBridge().getSources().forEach((name, source) -> {
            if (adapters.containsKey(name)) {
                return;
            }
            register(new BridgeSourceAdapter(name, bridgeUrl + source.getPath(), source.getKind(),
                    restTemplate, bridgeMapper));
        });

        log.info("🔌 {} source adapters registered: {}", adapters.size(), adapters.keySet());
    }

    public Optional<SourceAdapter> find(String name) {
        return Optional.ofNullable(adapters.get(name));
    }

    public Set<String> names() {
        return adapters.keySet();
    }

    private void register(SourceAdapter adapter) {
        SourceAdapter previous = adapters.putIfAbsent(adapter.name(), adapter);
        if (previous != null) {
            throw new IllegalStateException("Duplicate source adapter name: " + adapter.name());
        }
    }
}
