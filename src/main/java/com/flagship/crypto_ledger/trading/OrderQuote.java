package com.flagship.crypto_ledger.trading;

import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The balance legs of one market order, computed before anything is locked.
 *
 * buy:  quoteAmount = amount * price * (1 + feeRate), rounded up; debited from quote
 * sell: quoteAmount = amount * price * (1 - feeRate), rounded down; credited to quote
 *
 * Rounding always favours the ledger so an order never creates value.
 * fee is everything between the recorded gross value and quoteAmount, rounding
 * excess included, so grossValue + fee = quoteAmount on a buy and
 * grossValue - fee = quoteAmount on a sell.
 */
@Value
public class OrderQuote {

    private static final int SCALE = TradingSettings.AMOUNT_SCALE;

    TradingPair pair;
    OrderSide side;
    BigDecimal amount;
    BigDecimal price;
    BigDecimal grossValue;
    BigDecimal fee;
    BigDecimal quoteAmount;

    public static OrderQuote of(TradingPair pair, OrderSide side, BigDecimal amount,
                                BigDecimal price, BigDecimal feeRate) {
        BigDecimal unitPrice = price.setScale(SCALE, RoundingMode.HALF_EVEN);
        if (unitPrice.signum() <= 0) {
            throw new InvalidOperationException("Price must be greater than zero: " + price.toPlainString());
        }
        Amounts.requireStorable(unitPrice, "Price");

        BigDecimal gross = amount.multiply(unitPrice);
        BigDecimal rawFee = gross.multiply(feeRate);
        BigDecimal grossValue = gross.setScale(SCALE, RoundingMode.HALF_EVEN);

        BigDecimal quoteAmount;
        BigDecimal fee;
        if (side == OrderSide.BUY) {
            quoteAmount = gross.add(rawFee).setScale(SCALE, RoundingMode.UP);
            fee = quoteAmount.subtract(grossValue);
        } else {
            quoteAmount = gross.subtract(rawFee).setScale(SCALE, RoundingMode.DOWN);
            fee = grossValue.subtract(quoteAmount);
        }

        if (quoteAmount.signum() <= 0) {
            throw new InvalidOperationException(String.format(
                "Order value too small: %s %s at %s", amount.toPlainString(), pair, unitPrice.toPlainString()));
        }
        Amounts.requireStorable(grossValue, "Order value");
        Amounts.requireStorable(quoteAmount, "Order value");

        return new OrderQuote(pair, side, amount, unitPrice, grossValue, fee, quoteAmount);
    }

    /**
     * Currency the account pays with.
     */
    public String debitCurrency() {
        return side == OrderSide.BUY ? pair.getQuote() : pair.getBase();
    }

    public BigDecimal debitAmount() {
        return side == OrderSide.BUY ? quoteAmount : amount;
    }

    public String creditCurrency() {
        return side == OrderSide.BUY ? pair.getBase() : pair.getQuote();
    }

    public BigDecimal creditAmount() {
        return side == OrderSide.BUY ? amount : quoteAmount;
    }
}
