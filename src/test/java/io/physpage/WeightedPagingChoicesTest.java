package io.physpage;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class WeightedPagingChoicesTest {
    @Test
    public void testSingleWeightAlwaysWins() {
        var config = Config.newBuilder()
                .setInstructionPageAliasingWeights(Map.of(1, 5))
                .setDataPageAliasingWeights(Map.of(0, 3, 1, 0))
                .build();
        var choices = new WeightedPagingChoices(config, new Random(1));
        for (int i = 0; i < 100; ++i) {
            assertThat(choices.getPlainPagingChoice(PagingChoicesAdapter.INSTRUCTION_PAGE_ALIASING), is(1));
            assertThat(choices.getPlainPagingChoice(PagingChoicesAdapter.DATA_PAGE_ALIASING), is(0));
        }
    }

    @Test
    public void testWeightsShapeTheDistribution() {
        var config = Config.newBuilder()
                .setDataPageAliasingWeight(0, 50)
                .setDataPageAliasingWeight(1, 50)
                .build();
        var choices = new WeightedPagingChoices(config, new Random(3));
        int aliasFirst = 0;
        for (int i = 0; i < 10000; ++i) {
            aliasFirst += choices.getPlainPagingChoice(PagingChoicesAdapter.DATA_PAGE_ALIASING);
        }
        assertThat(aliasFirst, is(allOf(greaterThan(4500), lessThan(5500))));
    }

    @Test
    public void testUnknownChoiceIsFatal() {
        var choices = new WeightedPagingChoices(Config.newBuilder().build(), new Random(1));
        var error = assertThrows(PageManagerError.class, () -> choices.getPlainPagingChoice("Page Table Aliasing"));
        assertThat(error.getCode(), is("unknown_paging_choice"));
    }
}
