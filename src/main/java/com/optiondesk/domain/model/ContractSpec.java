package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.OptionRight;
import com.optiondesk.domain.enums.SecurityType;
import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contract description handed to the gateway. Stocks carry symbol/exchange/currency, options add
 * expiry, strike, right and optionally the trading class, combos carry their legs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractSpec {

    private String symbol;
    private SecurityType secType;
    private String exchange;
    private String currency;

    /** yyyyMMdd for options. */
    private String lastTradeDate;

    private BigDecimal strike;
    private OptionRight right;
    private String multiplier;
    private String tradingClass;

    /** Zero until resolved. */
    private long conId;

    private List<ComboLeg> comboLegs;

    public static ContractSpec stock(String symbol, String exchange, String currency) {
        return ContractSpec.builder()
                .symbol(symbol)
                .secType(SecurityType.STK)
                .exchange(exchange)
                .currency(currency)
                .build();
    }

    public static ContractSpec option(
            String symbol, String expiry, BigDecimal strike, OptionRight right, String exchange, String currency) {
        return ContractSpec.builder()
                .symbol(symbol)
                .secType(SecurityType.OPT)
                .lastTradeDate(expiry)
                .strike(Strikes.normalize(strike))
                .right(right)
                .multiplier("100")
                .exchange(exchange)
                .currency(currency)
                .build();
    }

    public static ContractSpec combo(String symbol, List<ComboLeg> legs, String exchange, String currency) {
        return ContractSpec.builder()
                .symbol(symbol)
                .secType(SecurityType.BAG)
                .exchange(exchange)
                .currency(currency)
                .comboLegs(List.copyOf(legs))
                .build();
    }
}
