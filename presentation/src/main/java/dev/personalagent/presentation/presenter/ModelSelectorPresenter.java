package dev.personalagent.presentation.presenter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.domain.ModelInfo;
import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.event.ViewId;
import dev.personalagent.core.service.ModelsRegistryService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.view.ErrorSeverity;
import dev.personalagent.presentation.view.ViewCommand;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Model picker: free-text search combined with an optional provider filter.
 */
@Singleton
public class ModelSelectorPresenter extends AbstractPresenter {

    private final ModelsRegistryService models;

    // Picker state, only touched from the event loop
    private boolean open;
    private String query = "";
    private String providerFilter;

    @Inject
    public ModelSelectorPresenter(EventBus eventBus, ViewCommandSink sink, @Named(EXECUTOR) Executor executor,
            ModelsRegistryService models) {
        super(eventBus, sink, executor);
        this.models = models;
    }

    @Override
    protected void handle(AppEvent event) {
        if (event instanceof UserEvent.OpenModelSelector) {
            openSelector();
        } else if (event instanceof UserEvent.SearchModels search) {
            query = search.query() == null ? "" : search.query().trim();
            attempt("Model Search Failed", ErrorSeverity.ERROR, this::sendResults);
        } else if (event instanceof UserEvent.FilterModelsByProvider filter) {
            providerFilter = filter.providerId();
            attempt("Model Search Failed", ErrorSeverity.ERROR, this::sendResults);
        } else if (event instanceof UserEvent.SelectModel select) {
            selectModel(select.providerId(), select.modelId());
        } else if (event instanceof UserEvent.NavigateBack) {
            open = false;
        } else if (event instanceof SystemEvent.ModelsRegistryRefreshed && open) {
            attempt("Model Search Failed", ErrorSeverity.WARNING, this::sendResults);
        }
    }

    private void openSelector() {
        open = true;
        query = "";
        providerFilter = null;
        send(new ViewCommand.NavigateTo(ViewId.MODEL_SELECTOR));
        attempt("Could Not Load Models", ErrorSeverity.ERROR, () -> {
            send(new ViewCommand.ModelProvidersLoaded(await(models.listProviders())));
            sendResults();
        });
    }

    private void sendResults() throws ServiceException {
        List<ModelInfo> results;
        if (query.isEmpty()) {
            results = providerFilter == null ? await(models.listAll()) : await(models.listByProvider(providerFilter));
        } else {
            results = await(models.search(query)).stream()
                    .filter(model -> providerFilter == null || providerFilter.equals(model.providerId()))
                    .toList();
        }
        send(new ViewCommand.ModelSearchResults(results));
    }

    private void selectModel(String providerId, String modelId) {
        attempt("Could Not Select Model", ErrorSeverity.ERROR, () -> {
            Optional<ModelInfo> model = await(models.getModel(providerId, modelId));
            if (model.isEmpty()) {
                showError("Unknown Model", "Model '" + modelId + "' is not offered by '" + providerId + "'",
                        ErrorSeverity.WARNING);
                return;
            }
            open = false;
            send(new ViewCommand.ModelSelected(providerId, modelId, model.get().name()));
            send(new ViewCommand.NavigateBack());
        });
    }
}
