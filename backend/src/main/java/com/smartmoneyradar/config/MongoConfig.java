package com.smartmoneyradar.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Valuations, liquidity and native amounts are persisted as Decimal128 and read back as BigDecimal.
 * Indexes come from @CompoundIndex / @Indexed on the documents (auto-index-creation).
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(UsdAmountWriter.INSTANCE, UsdAmountReader.INSTANCE));
    }

    /** Rounds to 34 significant digits; products such as native amount times price can exceed it. */
    @WritingConverter
    enum UsdAmountWriter implements Converter<BigDecimal, Decimal128> {
        INSTANCE;

        @Override
        public Decimal128 convert(BigDecimal source) {
            return new Decimal128(source.round(MathContext.DECIMAL128));
        }
    }

    @ReadingConverter
    enum UsdAmountReader implements Converter<Decimal128, BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }
}
