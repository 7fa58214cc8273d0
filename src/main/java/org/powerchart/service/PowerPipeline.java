package org.powerchart.service;

import org.powerchart.config.AppConfig;
import org.powerchart.correction.CorrectionTable;
import org.powerchart.model.AggregationResult;
import org.powerchart.model.Dataset;
import org.powerchart.model.Request;
import org.powerchart.model.Series;
import org.powerchart.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one chart request: load, clean, align, aggregate.
 *
 * <p>Each call works on freshly loaded datasets, so a pipeline instance can serve several
 * requests one after another.</p>
 */
public class PowerPipeline {

    private static final Logger log = LoggerFactory.getLogger(PowerPipeline.class);

    private final PowerLogService logService;
    private final SeriesCleaner cleaner;
    private final TimelineAligner aligner;
    private final WindowAggregator aggregator;

    public PowerPipeline(AppConfig config) {
        this(new PowerLogService(config),
                new SeriesCleaner(),
                new TimelineAligner(),
                new WindowAggregator(CorrectionTable.standard(), config.getZone()));
    }

    public PowerPipeline(PowerLogService logService,
                         SeriesCleaner cleaner,
                         TimelineAligner aligner,
                         WindowAggregator aggregator) {
        this.logService = Objects.requireNonNull(logService, "logService");
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
        this.aligner = Objects.requireNonNull(aligner, "aligner");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    }

    /**
     * Loads the logs the request needs and computes its chart data.
     *
     * @throws IOException          if a log file cannot be read
     * @throws PowerDataException   if the data cannot be reconciled or aggregated
     */
    public AggregationResult run(Request request) throws IOException {
        log.info("Request: group '{}', {} to {}, {} points, {}",
                request.group(), request.start(), request.end(), request.windowCount(), request.mode());
        List<String> disclaimers = new ArrayList<>();

        Dataset hpc = logService.loadHpc(request);
        int samples = hpc.getChannel(request.group()).map(Series::size).orElse(0);
        if (samples < request.windowCount()) {
            throw new InsufficientDataException(request.group(), samples, request.windowCount());
        }

        Dataset ent = request.needsEnterprise() ? logService.loadEnt(request, disclaimers) : new Dataset(Source.ENT);
        Dataset ups = request.needsUps() ? logService.loadUps(request, disclaimers) : new Dataset(Source.UPS);

        return process(hpc, ups, ent, request, disclaimers);
    }

    /**
     * Cleans, aligns and aggregates datasets that are already loaded.
     */
    public AggregationResult process(Dataset hpc,
                                     Dataset ups,
                                     Dataset ent,
                                     Request request,
                                     List<String> disclaimers) {
        cleaner.clean(hpc);
        cleaner.clean(ups);
        cleaner.clean(ent);

        aligner.align(hpc, ups, ent);

        AggregationResult result = aggregator.aggregate(hpc, ups, ent, request, disclaimers);
        log.info(result.summary());
        return result;
    }
}
