package com.streamhub.mapper;

import com.streamhub.domain.model.StockPrice;
import com.streamhub.market.provider.PolygonAggregatesResponse;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * Maps provider aggregate bars to domain price bars. Prices are rounded to 2 decimals.
 */
@Mapper
public interface PolygonBarMapper {

    @Mapping(source = "t", target = "timestamp", qualifiedByName = "epochMillisToInstant")
    @Mapping(source = "o", target = "open", qualifiedByName = "toPrice")
    @Mapping(source = "h", target = "high", qualifiedByName = "toPrice")
    @Mapping(source = "l", target = "low", qualifiedByName = "toPrice")
    @Mapping(source = "c", target = "close", qualifiedByName = "toPrice")
    @Mapping(source = "v", target = "volume", qualifiedByName = "toVolume")
    StockPrice toStockPrice(PolygonAggregatesResponse.Bar bar);

    List<StockPrice> toStockPrices(List<PolygonAggregatesResponse.Bar> bars);

    @Named("epochMillisToInstant")
    default Instant epochMillisToInstant(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis);
    }

    @Named("toPrice")
    default BigDecimal toPrice(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    @Named("toVolume")
    default long toVolume(double value) {
        return Math.round(value);
    }
}
