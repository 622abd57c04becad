package io.physpage;

import io.physpage.memory.Constants;
import io.physpage.memory.PageSizeClass;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConfigTest {
    @Test
    public void testDefaults() {
        var config = Config.newBuilder().build();
        assertThat(config.getRandomSeed(), is(0L));
        assertThat(config.getMaxPhysicalAddress(), is(Constants.DEFAULT_MAX_PHYSICAL_ADDRESS));
        assertThat(config.getPageSizeClasses(), is(PageSizeClass.SIZE_CLASSES));
        assertThat(config.getInstructionPageAliasingWeights(), is(Map.of(0, 90, 1, 10)));
        assertThat(config.getDataPageAliasingWeights(), is(Map.of(0, 90, 1, 10)));
    }

    @Test
    public void testBuiltConfigIsIsolatedFromBuilder() {
        var builder = Config.newBuilder().setRandomSeed(42).setPageSizeClasses(List.of(PageSizeClass.S4K));
        var config = builder.build();
        builder.setRandomSeed(7).setPageSizeClasses(List.of(PageSizeClass.S2M));
        assertThat(config.getRandomSeed(), is(42L));
        assertThat(config.getPageSizeClasses(), is(List.of(PageSizeClass.S4K)));
    }

    @Test
    public void testInvalidSettingsAreRejected() {
        assertThrows(IllegalStateException.class, () -> Config.newBuilder().setPageSizeClasses(List.of()).build());
        assertThrows(IllegalStateException.class,
                () -> Config.newBuilder().setDataPageAliasingWeights(Map.of(0, 0)).build());
        assertThrows(IllegalStateException.class,
                () -> Config.newBuilder().setInstructionPageAliasingWeight(1, -1).build());
    }
}
