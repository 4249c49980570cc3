package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum BindingKind {
    @JsonProperty("event") EVENT,
    @JsonProperty("property") PROPERTY,
    @JsonProperty("twoWay") TWO_WAY
}
