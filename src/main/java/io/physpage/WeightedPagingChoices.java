package io.physpage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;

public class WeightedPagingChoices implements PagingChoicesAdapter {
    private static final Logger log = LoggerFactory.getLogger(WeightedPagingChoices.class);

    private final Map<String, SortedMap<Integer, Integer>> choices = new HashMap<>();
    private final Random random;

    public WeightedPagingChoices(Config config, Random random) {
        this.random = random;
        this.choices.put(INSTRUCTION_PAGE_ALIASING, new TreeMap<>(config.getInstructionPageAliasingWeights()));
        this.choices.put(DATA_PAGE_ALIASING, new TreeMap<>(config.getDataPageAliasingWeights()));
    }

    @Override
    public int getPlainPagingChoice(String name) {
        var weights = this.choices.get(name);
        if (weights == null) {
            log.error("no weights configured for paging choice \"{}\"", name);
            throw new PageManagerError("unknown_paging_choice", name);
        }
        long total = 0;
        for (int weight : weights.values()) {
            total += weight;
        }
        long pick = this.random.nextLong(total);
        for (var entry : weights.entrySet()) {
            pick -= entry.getValue();
            if (pick < 0) {
                return entry.getKey();
            }
        }
        throw new IllegalStateException("weighted pick out of range for " + name);
    }
}
