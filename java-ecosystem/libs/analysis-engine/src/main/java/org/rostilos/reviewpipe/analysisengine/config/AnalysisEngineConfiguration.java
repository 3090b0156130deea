package org.rostilos.reviewpipe.analysisengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.reviewpipe.analysisengine.extract.ExtractedFindingsFormatter;
import org.rostilos.reviewpipe.analysisengine.extract.ReportMarkdownExtractor;
import org.rostilos.reviewpipe.analysisengine.parser.UnifiedDiffParser;
import org.rostilos.reviewpipe.analysisengine.pipeline.ReportAggregator;
import org.rostilos.reviewpipe.analysisengine.report.JsonReportRenderer;
import org.rostilos.reviewpipe.analysisengine.report.MarkdownReportRenderer;
import org.rostilos.reviewpipe.analysisengine.report.ReportOutputWriter;
import org.rostilos.reviewpipe.analysisengine.report.ReportRenderer;
import org.rostilos.reviewpipe.analysisengine.stage.AnalysisStageFactory;
import org.rostilos.reviewpipe.analysisengine.stage.FindingsResponseParser;
import org.rostilos.reviewpipe.analysisengine.stage.RemoteAnalysisStageFactory;
import org.rostilos.reviewpipe.analysisengine.stage.StagePromptFormatter;
import org.rostilos.reviewpipe.vcsclient.VcsDiffProvider;
import org.rostilos.reviewpipe.vcsclient.git.LocalGitDiffProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.util.List;

@Configuration
@EnableConfigurationProperties(ReviewPipeProperties.class)
public class AnalysisEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public VcsDiffProvider vcsDiffProvider(ReviewPipeProperties properties) {
        return new LocalGitDiffProvider(Path.of(properties.getRepositoryPath()));
    }

    @Bean
    public UnifiedDiffParser unifiedDiffParser(ReviewPipeProperties properties, VcsDiffProvider vcsDiffProvider) {
        return new UnifiedDiffParser(properties.getDiff().getSupportedExtensions(), vcsDiffProvider);
    }

    @Bean
    public AnalysisStageFactory analysisStageFactory(
            @Qualifier("reviewRestTemplate") RestTemplate restTemplate,
            ReviewPipeProperties properties,
            ObjectMapper objectMapper
    ) {
        return new RemoteAnalysisStageFactory(
                restTemplate,
                properties.getAi().getUrl(),
                properties.getAi().getMaxPromptTokens(),
                new StagePromptFormatter(),
                new FindingsResponseParser(objectMapper)
        );
    }

    @Bean
    public ReportAggregator reportAggregator() {
        return new ReportAggregator();
    }

    @Bean
    public MarkdownReportRenderer markdownReportRenderer() {
        return new MarkdownReportRenderer();
    }

    @Bean
    public JsonReportRenderer jsonReportRenderer(ObjectMapper objectMapper) {
        return new JsonReportRenderer(objectMapper);
    }

    @Bean
    public ReportOutputWriter reportOutputWriter(List<ReportRenderer> renderers) {
        return new ReportOutputWriter(renderers);
    }

    @Bean
    public ReportMarkdownExtractor reportMarkdownExtractor() {
        return new ReportMarkdownExtractor();
    }

    @Bean
    public ExtractedFindingsFormatter extractedFindingsFormatter(ObjectMapper objectMapper) {
        return new ExtractedFindingsFormatter(objectMapper);
    }
}
