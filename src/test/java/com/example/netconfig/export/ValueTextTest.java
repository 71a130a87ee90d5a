package com.example.netconfig.export;

import com.example.netconfig.domain.Activation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ValueTextTest {

    @Test
    void plain_notation_from_ten_thousandths_upwards() {
        assertThat(ValueText.decimal(0.0005)).isEqualTo("0.0005");
        assertThat(ValueText.decimal(1.0E-4)).isEqualTo("0.0001");
        assertThat(ValueText.decimal(12345678.0)).isEqualTo("12345678.0");
        assertThat(ValueText.decimal(1.0E15)).isEqualTo("1000000000000000.0");
    }

    @Test
    void exponent_notation_outside_the_plain_range() {
        assertThat(ValueText.decimal(1.0E-5)).isEqualTo("1e-05");
        assertThat(ValueText.decimal(1.5E-7)).isEqualTo("1.5e-07");
        assertThat(ValueText.decimal(-2.5E-5)).isEqualTo("-2.5e-05");
        assertThat(ValueText.decimal(1.0E16)).isEqualTo("1e+16");
        assertThat(ValueText.decimal(1.25E123)).isEqualTo("1.25e+123");
    }

    @Test
    void ordinary_values_keep_a_fraction() {
        assertThat(ValueText.decimal(0.1)).isEqualTo("0.1");
        assertThat(ValueText.decimal(100.0)).isEqualTo("100.0");
        assertThat(ValueText.decimal(-2.5)).isEqualTo("-2.5");
        assertThat(ValueText.decimal(0.0)).isEqualTo("0.0");
        assertThat(ValueText.decimal(-0.0)).isEqualTo("-0.0");
    }

    @Test
    void non_finite_values() {
        assertThat(ValueText.decimal(Double.NaN)).isEqualTo("nan");
        assertThat(ValueText.decimal(Double.POSITIVE_INFINITY)).isEqualTo("inf");
        assertThat(ValueText.decimal(Double.NEGATIVE_INFINITY)).isEqualTo("-inf");
    }

    @Test
    void integers_and_joins() {
        assertThat(ValueText.number(100)).isEqualTo("100");
        assertThat(ValueText.join(List.of(0.5, 1.0E-5), ",")).isEqualTo("0.5,1e-05");
        assertThat(ValueText.activation(null)).isEqualTo("none");
        assertThat(ValueText.activation(Activation.RELU)).isEqualTo("relu");
    }
}
