package cn.hjw.dev.wrangleflow.config;

import cn.hjw.dev.wrangleflow.model.NodeKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Getter
@ToString
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VisualizeConfig extends AbstractNodeConfig {

    public static final Set<String> VISUALIZATION_TYPES = Set.of("bar", "line", "scatter", "histogram", "pie");

    private String visualizationType = "bar";
    // xColumn 的 Lombok getter 会被 Jackson 推断成 "xcolumn"，显式指定属性名
    @Getter(AccessLevel.NONE)
    @JsonProperty("x_column")
    private String xColumn;

    @Getter(AccessLevel.NONE)
    @JsonProperty("y_column")
    private String yColumn;

    private int bins = 10;
    private String title;

    @JsonProperty("x_column")
    public String getXColumn() {
        return xColumn;
    }

    @JsonProperty("y_column")
    public String getYColumn() {
        return yColumn;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VISUALIZE;
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!oneOf(VISUALIZATION_TYPES, visualizationType)) {
            errors.add("Unsupported visualization type: " + visualizationType);
            return errors;
        }
        if (StringUtils.isBlank(xColumn)) {
            errors.add("x_column is required");
        }
        if (("scatter".equals(visualizationType) || "line".equals(visualizationType))
                && StringUtils.isBlank(yColumn)) {
            errors.add("y_column is required for " + visualizationType + " charts");
        }
        if ("histogram".equals(visualizationType) && bins <= 0) {
            errors.add("bins must be positive");
        }
        return errors;
    }
}
