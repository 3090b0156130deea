package org.rostilos.reviewpipe.analysisengine.config;

import org.rostilos.reviewpipe.analysisengine.parser.UnifiedDiffParser;
import org.rostilos.reviewpipe.analysisengine.stage.StageDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for review runs.
 */
@ConfigurationProperties(prefix = "reviewpipe")
public class ReviewPipeProperties {

    /**
     * Git working tree or repository directory used for commit diffs.
     */
    private String repositoryPath = ".";

    private final Diff diff = new Diff();

    private final Ai ai = new Ai();

    /**
     * Stages in execution order.
     */
    private List<Stage> stages = defaultStages();

    private final Output output = new Output();

    public String getRepositoryPath() {
        return repositoryPath;
    }

    public void setRepositoryPath(String repositoryPath) {
        this.repositoryPath = repositoryPath;
    }

    public Diff getDiff() {
        return diff;
    }

    public Ai getAi() {
        return ai;
    }

    public List<Stage> getStages() {
        return stages;
    }

    public void setStages(List<Stage> stages) {
        this.stages = stages;
    }

    public Output getOutput() {
        return output;
    }

    public List<StageDefinition> toStageDefinitions() {
        return stages.stream()
                .map(s -> new StageDefinition(s.getName(), s.isEnabled(), s.getFocus()))
                .toList();
    }

    private static List<Stage> defaultStages() {
        List<Stage> defaults = new ArrayList<>();
        defaults.add(new Stage("code-review",
                "Code quality, naming, error handling, duplication and maintainability issues."));
        defaults.add(new Stage("security",
                "Security vulnerabilities: injection, XSS, broken authentication, sensitive data exposure, OWASP Top 10."));
        defaults.add(new Stage("performance",
                "Performance problems: inefficient algorithms, N+1 queries, memory leaks, blocking I/O, needless re-renders."));
        return defaults;
    }

    public static class Diff {

        /**
         * File suffixes kept by the diff parser.
         */
        private List<String> supportedExtensions = new ArrayList<>(UnifiedDiffParser.DEFAULT_SUPPORTED_EXTENSIONS);

        public List<String> getSupportedExtensions() {
            return supportedExtensions;
        }

        public void setSupportedExtensions(List<String> supportedExtensions) {
            this.supportedExtensions = supportedExtensions;
        }
    }

    public static class Ai {

        /**
         * Review service endpoint receiving stage requests.
         */
        private String url = "http://localhost:8000/review";

        private int connectTimeoutSeconds = 20;

        private int readTimeoutMinutes = 30;

        /**
         * Prompt token budget per stage call; zero or less disables the check.
         */
        private int maxPromptTokens = 100_000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getConnectTimeoutSeconds() {
            return connectTimeoutSeconds;
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = connectTimeoutSeconds;
        }

        public int getReadTimeoutMinutes() {
            return readTimeoutMinutes;
        }

        public void setReadTimeoutMinutes(int readTimeoutMinutes) {
            this.readTimeoutMinutes = readTimeoutMinutes;
        }

        public int getMaxPromptTokens() {
            return maxPromptTokens;
        }

        public void setMaxPromptTokens(int maxPromptTokens) {
            this.maxPromptTokens = maxPromptTokens;
        }
    }

    public static class Stage {
        private String name;
        private boolean enabled = true;
        private String focus;

        public Stage() {
        }

        public Stage(String name, String focus) {
            this.name = name;
            this.focus = focus;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFocus() {
            return focus;
        }

        public void setFocus(String focus) {
            this.focus = focus;
        }
    }

    public static class Output {

        private String directory = "./reports";

        private List<String> formats = new ArrayList<>(List.of("markdown", "json"));

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public List<String> getFormats() {
            return formats;
        }

        public void setFormats(List<String> formats) {
            this.formats = formats;
        }
    }
}
