package tw.gc.stock.crawler.sources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import tw.gc.stock.crawler.sources.records.NormalizedRecord;
import tw.gc.stock.crawler.sources.records.RecordKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Source adapter backed by the scraping bridge.
 *
 * <p>The bridge exposes one JSON endpoint per external site and returns an
 * array of already normalized objects in snake_case, e.g.
 * {@code GET /sources/twse/quote/2024-03-01}. This adapter only maps that
 * array onto the record type of its {@link RecordKind}.</p>
 */
@Slf4j
public class BridgeSourceAdapter implements SourceAdapter {

    private final String name;
    private final String url;
    private final RecordKind kind;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final JavaType listType;

    public BridgeSourceAdapter(String name, String url, RecordKind kind,
                               RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.name = name;
        this.url = url;
        this.kind = kind;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.listType = objectMapper.getTypeFactory()
                .constructCollectionType(List.class, kind.recordType());
    }

    @Override
    public String name() {
        return name;
    }

    public RecordKind kind() {
        return kind;
    }

    @Override
    public List<NormalizedRecord> fetch(FetchTarget target) throws FetchException {
        String resolved = url.replace("{key}", target.key());
        String response;
        try {
            response = restTemplate.getForObject(resolved, String.class);
        } catch (RestClientException e) {
            throw new FetchException(target, "request to " + resolved + " failed: " + e.getMessage(), e);
        }

        if (response == null || response.isBlank()) {
            log.debug("Empty response from {} for {}", name, target.key());
            return List.of();
        }

        try {
            List<? extends NormalizedRecord> records = objectMapper.readValue(response, listType);
            return new ArrayList<>(records);
        } catch (JsonProcessingException e) {
            throw new FetchException(target, "unparseable payload from " + name + ": " + e.getOriginalMessage(), e);
        }
    }
}
