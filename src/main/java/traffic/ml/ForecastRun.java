package traffic.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Everything one pipeline run produced, in stage order. The forecast is absent when no
 * ranked model passed diagnostics; accuracy is absent without validation data.
 */
public final class ForecastRun {

    private final BoxCoxSelector.Selection transformSelection;
    private final StationarityReducer.Result reduction;
    private final List<SarimaOrder> candidates;
    private final ModelSearchEngine.SearchResult search;
    private final List<DiagnosticsEngine.Report> reports;
    private final DiagnosticsEngine.Report selected;
    private final Forecast forecast;
    private final ForecastAccuracy accuracy;

    ForecastRun(BoxCoxSelector.Selection transformSelection,
                StationarityReducer.Result reduction,
                List<SarimaOrder> candidates,
                ModelSearchEngine.SearchResult search,
                List<DiagnosticsEngine.Report> reports,
                DiagnosticsEngine.Report selected,
                Forecast forecast,
                ForecastAccuracy accuracy) {
        this.transformSelection = transformSelection;
        this.reduction = reduction;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.search = search;
        this.reports = Collections.unmodifiableList(new ArrayList<>(reports));
        this.selected = selected;
        this.forecast = forecast;
        this.accuracy = accuracy;
    }

    public BoxCoxSelector.Selection getTransformSelection() { return transformSelection; }
    public TransformSpec getTransform() { return transformSelection.getChosen(); }
    public StationarityReducer.Result getReduction() { return reduction; }
    public List<SarimaOrder> getCandidates() { return candidates; }
    public ModelSearchEngine.SearchResult getSearch() { return search; }
    /** Diagnostics for every ranked model, in ranking order. */
    public List<DiagnosticsEngine.Report> getReports() { return reports; }
    public Optional<DiagnosticsEngine.Report> getSelected() { return Optional.ofNullable(selected); }
    public Optional<Forecast> getForecast() { return Optional.ofNullable(forecast); }
    public Optional<ForecastAccuracy> getAccuracy() { return Optional.ofNullable(accuracy); }
}
