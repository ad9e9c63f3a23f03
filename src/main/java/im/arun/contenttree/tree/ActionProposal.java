package im.arun.contenttree.tree;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionProposal {

    @JsonProperty("summary")
    private String summary;

    @JsonProperty("actions")
    private List<TreeAction> actions = new ArrayList<>();

    public static ActionProposal empty() {
        return new ActionProposal("", new ArrayList<>());
    }
}
