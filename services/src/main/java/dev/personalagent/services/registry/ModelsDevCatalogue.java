package dev.personalagent.services.registry;

import com.fasterxml.jackson.databind.JsonNode;
import dev.personalagent.services.registry.CatalogModelsRegistryService.Catalogue;
import dev.personalagent.services.registry.CatalogModelsRegistryService.ModelEntry;
import dev.personalagent.services.registry.CatalogModelsRegistryService.ProviderEntry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The provider and model list published by models.dev. The API returns an
 * object keyed by provider id, each provider holding an object of models
 * keyed by model id.
 */
public class ModelsDevCatalogue implements RemoteCatalogue<Catalogue> {

    public static final String API_URL = "https://models.dev/api.json";

    private final HttpJsonClient http;
    private final String url;

    public ModelsDevCatalogue(HttpJsonClient http) {
        this(http, API_URL);
    }

    public ModelsDevCatalogue(HttpJsonClient http, String url) {
        this.http = http;
        this.url = url;
    }

    @Override
    public Catalogue fetch() throws IOException {
        return parse(http.get(url, Map.of()));
    }

    static Catalogue parse(JsonNode root) throws IOException {
        if (!root.isObject()) {
            throw new IOException("Unexpected models.dev response: not an object");
        }
        List<ProviderEntry> providers = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode provider = field.getValue();
            String providerId = provider.path("id").asText(field.getKey());

            List<ModelEntry> models = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> modelFields = provider.path("models").fields();
            while (modelFields.hasNext()) {
                Map.Entry<String, JsonNode> modelField = modelFields.next();
                JsonNode model = modelField.getValue();
                JsonNode context = model.path("limit").path("context");
                models.add(new ModelEntry(
                        model.path("id").asText(modelField.getKey()),
                        model.path("name").asText(modelField.getKey()),
                        context.canConvertToInt() ? context.asInt() : null));
            }
            providers.add(new ProviderEntry(providerId, provider.path("name").asText(providerId),
                    provider.hasNonNull("api") ? provider.get("api").asText() : null, models));
        }
        return new Catalogue(providers);
    }
}
