package perf.report.reporter;

import com.fasterxml.jackson.annotation.JsonProperty;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Defaults of a report run. Command line options override the values read from here.
 */
public class Configuration {

    @NotEmpty
    @JsonProperty("report.path")
    private String reportPath = "report.json";

    @NotNull
    @DecimalMin("0")
    @DecimalMax("100")
    @JsonProperty("min.func.percent")
    private Double minFuncPercent = 0.01;

    @NotNull
    @JsonProperty("interpreter.libraries")
    private List<String> interpreterLibraries = new ArrayList<>(Arrays.asList("libart.so", "libartd.so"));

    /**
     * 0 sizes the loader pool by the number of captures.
     */
    @NotNull
    @Min(0)
    @JsonProperty("loader.threads")
    private Integer loaderThreads = 0;

    @NotNull
    @Min(1)
    @JsonProperty("annotation.cache.size")
    private Long annotationCacheSize = 100_000L;

    @NotNull
    @JsonProperty("binary_cache.annotations.file")
    private String annotationsFileName = "annotations.json";

    @JsonProperty("metrics.log.enabled")
    private boolean metricsLogEnabled = true;

    public String getReportPath() {
        return reportPath;
    }

    public Double getMinFuncPercent() {
        return minFuncPercent;
    }

    public List<String> getInterpreterLibraries() {
        return interpreterLibraries;
    }

    public Integer getLoaderThreads() {
        return loaderThreads;
    }

    public Long getAnnotationCacheSize() {
        return annotationCacheSize;
    }

    public String getAnnotationsFileName() {
        return annotationsFileName;
    }

    public boolean isMetricsLogEnabled() {
        return metricsLogEnabled;
    }
}
