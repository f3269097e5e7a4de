package bigdata.clebeg.median.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SeriesValue {
    public static final String DEFAULT_KEY = "default";

    private String key;
    private double value;
}
