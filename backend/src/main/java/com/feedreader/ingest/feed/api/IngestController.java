package com.feedreader.ingest.feed.api;

import com.feedreader.ingest.feed.model.FeedSource;
import com.feedreader.ingest.feed.model.FetchEpoch;
import com.feedreader.ingest.feed.model.FetchRequest;
import com.feedreader.ingest.feed.model.FetchStartResponse;
import com.feedreader.ingest.feed.model.RegisterSourceRequest;
import com.feedreader.ingest.feed.model.ViewSnapshot;
import com.feedreader.ingest.feed.persistence.FeedSourceRepository;
import com.feedreader.ingest.feed.service.FetchOrchestratorService;
import com.feedreader.ingest.feed.view.FeedViewRegistry;
import com.feedreader.ingest.feed.view.InMemoryFeedView;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class IngestController {
    private final FetchOrchestratorService orchestratorService;
    private final FeedViewRegistry viewRegistry;
    private final FeedSourceRepository feedSourceRepository;

    public IngestController(
        FetchOrchestratorService orchestratorService,
        FeedViewRegistry viewRegistry,
        FeedSourceRepository feedSourceRepository
    ) {
        this.orchestratorService = orchestratorService;
        this.viewRegistry = viewRegistry;
        this.feedSourceRepository = feedSourceRepository;
    }

    @PostMapping("/views/{viewId}/fetch")
    public FetchStartResponse startFetch(
        @PathVariable("viewId") String viewId,
        @RequestBody(required = false) FetchViewRequest request
    ) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        FetchRequest fetchRequest = new FetchRequest(
            viewId,
            request.provider(),
            request.sourceUrl(),
            request.displayName(),
            request.categoryId(),
            request.categoryName(),
            request.searchQuery()
        );
        InMemoryFeedView view = viewRegistry.getOrCreate(viewId);
        FetchEpoch epoch = orchestratorService.fetch(fetchRequest, view);
        return new FetchStartResponse(viewId, epoch.id(), request.categoryId(), epoch.startedAt());
    }

    @GetMapping("/views/{viewId}")
    public ViewSnapshot getView(@PathVariable("viewId") String viewId) {
        return viewRegistry.find(viewId)
            .map(InMemoryFeedView::snapshot)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown view: " + viewId));
    }

    @GetMapping("/sources")
    public List<FeedSource> listSources() {
        return feedSourceRepository.findAll();
    }

    @PostMapping("/sources")
    public FeedSource registerSource(@RequestBody(required = false) RegisterSourceRequest request) {
        if (request == null || isBlank(request.name()) || isBlank(request.url())) {
            throw new ResponseStatusException(BAD_REQUEST, "name and url are required");
        }
        return feedSourceRepository.insert(request.name().trim(), request.url().trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
