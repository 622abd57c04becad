package io.physpage;

import io.physpage.memory.Constants;
import io.physpage.memory.PageSizeClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class Config {
    public static class Builder {
        private final Config config = new Config();

        public Builder setRandomSeed(long randomSeed) {
            this.config.randomSeed = randomSeed;
            return this;
        }

        public Builder setMaxPhysicalAddress(long maxPhysicalAddress) {
            this.config.maxPhysicalAddress = maxPhysicalAddress;
            return this;
        }

        public Builder setPageSizeClasses(List<PageSizeClass> pageSizeClasses) {
            this.config.pageSizeClasses.clear();
            this.config.pageSizeClasses.addAll(pageSizeClasses);
            return this;
        }

        public Builder setInstructionPageAliasingWeights(Map<Integer, Integer> weights) {
            this.config.instructionPageAliasingWeights.clear();
            this.config.instructionPageAliasingWeights.putAll(weights);
            return this;
        }

        public Builder setInstructionPageAliasingWeight(int choice, int weight) {
            this.config.instructionPageAliasingWeights.put(choice, weight);
            return this;
        }

        public Builder setDataPageAliasingWeights(Map<Integer, Integer> weights) {
            this.config.dataPageAliasingWeights.clear();
            this.config.dataPageAliasingWeights.putAll(weights);
            return this;
        }

        public Builder setDataPageAliasingWeight(int choice, int weight) {
            this.config.dataPageAliasingWeights.put(choice, weight);
            return this;
        }

        public Config build() {
            if (this.config.pageSizeClasses.isEmpty()) {
                throw new IllegalStateException("at least one page size class is required");
            }
            Config.checkWeights(PagingChoicesAdapter.INSTRUCTION_PAGE_ALIASING,
                    this.config.instructionPageAliasingWeights);
            Config.checkWeights(PagingChoicesAdapter.DATA_PAGE_ALIASING, this.config.dataPageAliasingWeights);
            return new Config(this.config);
        }
    }

    private long randomSeed = 0;
    private long maxPhysicalAddress = Constants.DEFAULT_MAX_PHYSICAL_ADDRESS;
    private final List<PageSizeClass> pageSizeClasses = new ArrayList<>(PageSizeClass.SIZE_CLASSES);
    private final Map<Integer, Integer> instructionPageAliasingWeights = new TreeMap<>();
    private final Map<Integer, Integer> dataPageAliasingWeights = new TreeMap<>();

    private Config() {
        this.instructionPageAliasingWeights.put(0, 90);
        this.instructionPageAliasingWeights.put(1, 10);
        this.dataPageAliasingWeights.put(0, 90);
        this.dataPageAliasingWeights.put(1, 10);
    }

    private Config(Config config) {
        this.randomSeed = config.randomSeed;
        this.maxPhysicalAddress = config.maxPhysicalAddress;
        this.pageSizeClasses.clear();
        this.pageSizeClasses.addAll(config.pageSizeClasses);
        this.instructionPageAliasingWeights.putAll(config.instructionPageAliasingWeights);
        this.dataPageAliasingWeights.putAll(config.dataPageAliasingWeights);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public long getRandomSeed() {
        return this.randomSeed;
    }

    public long getMaxPhysicalAddress() {
        return this.maxPhysicalAddress;
    }

    public List<PageSizeClass> getPageSizeClasses() {
        return List.copyOf(this.pageSizeClasses);
    }

    public Map<Integer, Integer> getInstructionPageAliasingWeights() {
        return Map.copyOf(this.instructionPageAliasingWeights);
    }

    public Map<Integer, Integer> getDataPageAliasingWeights() {
        return Map.copyOf(this.dataPageAliasingWeights);
    }

    private static void checkWeights(String name, Map<Integer, Integer> weights) {
        long total = 0;
        for (var weight : weights.values()) {
            if (weight < 0) {
                throw new IllegalStateException("negative weight for " + name);
            }
            total += weight;
        }
        if (total == 0) {
            throw new IllegalStateException("no positive weight for " + name);
        }
    }
}
