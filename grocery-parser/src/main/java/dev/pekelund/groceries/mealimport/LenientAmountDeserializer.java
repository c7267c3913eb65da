package dev.pekelund.groceries.mealimport;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads ingredient amounts written either as JSON numbers or as text such as {@code "2.5"},
 * {@code "1/2"} or {@code "1 1/2"}. Other text reads as {@code null}, so the importer's default
 * amount applies instead of the whole document being rejected.
 */
public class LenientAmountDeserializer extends StdDeserializer<BigDecimal> {

    private static final Logger LOGGER = LoggerFactory.getLogger(LenientAmountDeserializer.class);

    private static final Pattern DECIMAL = Pattern.compile("^\\d+(?:\\.\\d+)?$");
    private static final Pattern FRACTION = Pattern.compile(
        "^(?:(?<whole>\\d+)\\s+)?(?<numerator>\\d+)/(?<denominator>\\d+)$"
    );
    private static final int FRACTION_SCALE = 4;

    public LenientAmountDeserializer() {
        super(BigDecimal.class);
    }

    @Override
    public BigDecimal deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token != null && token.isNumeric()) {
            return parser.getDecimalValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            return parse(parser.getText());
        }
        return (BigDecimal) context.handleUnexpectedToken(BigDecimal.class, parser);
    }

    static BigDecimal parse(String text) {
        String value = text == null ? "" : text.trim();
        if (value.isEmpty()) {
            return null;
        }
        if (DECIMAL.matcher(value).matches()) {
            return new BigDecimal(value);
        }
        Matcher fraction = FRACTION.matcher(value);
        if (fraction.matches()) {
            BigDecimal denominator = new BigDecimal(fraction.group("denominator"));
            if (denominator.signum() != 0) {
                BigDecimal amount = new BigDecimal(fraction.group("numerator"))
                    .divide(denominator, FRACTION_SCALE, RoundingMode.HALF_UP);
                String whole = fraction.group("whole");
                return (whole != null ? amount.add(new BigDecimal(whole)) : amount).stripTrailingZeros();
            }
        }
        LOGGER.debug("Ignoring ingredient amount '{}'", value);
        return null;
    }
}
