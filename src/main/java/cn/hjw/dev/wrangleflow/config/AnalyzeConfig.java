package cn.hjw.dev.wrangleflow.config;

import cn.hjw.dev.wrangleflow.model.NodeKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Getter
@ToString
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalyzeConfig extends AbstractNodeConfig {

    public static final Set<String> ANALYSIS_TYPES = Set.of("statistical", "correlation");

    private String analysisType = "statistical";

    // 参与分析的列，为空时取全部数值列
    private List<String> columns;

    @Override
    public NodeKind getKind() {
        return NodeKind.ANALYZE;
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!oneOf(ANALYSIS_TYPES, analysisType)) {
            errors.add("Unsupported analysis type: " + analysisType);
        }
        return errors;
    }
}
