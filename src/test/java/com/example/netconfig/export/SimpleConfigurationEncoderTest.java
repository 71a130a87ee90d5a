package com.example.netconfig.export;

import com.example.netconfig.TestConfigurations;
import com.example.netconfig.domain.NetworkConfiguration;
import com.example.netconfig.domain.NeuronLayer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SimpleConfigurationEncoderTest {

    private final SimpleConfigurationEncoder encoder = new SimpleConfigurationEncoder();

    @Test
    void encodes_default_configuration() {
        assertThat(encoder.encode(NetworkConfiguration.defaults()))
                .isEqualTo("relu/2/2|3/0.1|0.2|0.3|0.4|0.5|0.6|/100//");
    }

    @Test
    void two_by_three_block_keeps_row_major_order() {
        List<Double> weights = List.of(0.1, 0.2, 0.3, 0.4, 0.5, 0.6);

        assertThat(SimpleConfigurationEncoder.reorderBlock(weights, 2, 3))
                .containsExactly(0.1, 0.2, 0.3, 0.4, 0.5, 0.6);
    }

    @Test
    void short_vector_skips_missing_indices() {
        assertThat(SimpleConfigurationEncoder.reorderBlock(List.of(1.0, 2.0, 3.0), 2, 2))
                .containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void weight_blocks_run_from_last_pair_to_first() {
        String[] fields = encoder.encode(TestConfigurations.threeLayer()).split("/", -1);

        assertThat(fields).containsExactly(
                "tanh",
                "3",
                "2|2|1",
                "5.0|6.0|1.0|2.0|3.0|4.0|",
                "250",
                "0.5,1.0|2.0,3.5|",
                "0.25,0.75|");
    }

    @Test
    void no_weights_leaves_only_the_trailing_separator() {
        NetworkConfiguration c = new NetworkConfiguration(
                List.of(new NeuronLayer(1, null), new NeuronLayer(1, null)),
                Map.of(), null, 5, null, null, null, null, null);

        assertThat(encoder.encode(c)).isEqualTo("none/2/1|1/|/5//");
    }

    @Test
    void small_and_large_values_are_written_plainly_inside_the_plain_range() {
        NetworkConfiguration c = new NetworkConfiguration(
                List.of(new NeuronLayer(1, null), new NeuronLayer(2, null)),
                Map.of("layer0_1", List.of(5.0E-4, 1.2345678E7)),
                null, null, null, List.of(List.of(1.0E-4, 1.0)), null, null, null);

        assertThat(encoder.encode(c)).isEqualTo("none/2/1|2/0.0005|12345678.0|/100/0.0001,1.0|/");
    }
}
