package org.Aayush.gridopt.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * JSON form of a topology definition.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GridDocument {
    private String name;
    private List<NodeDef> nodes;
    private List<EdgeDef> edges;

    /** One node; {@code role} is {@code generator} or {@code substation}. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NodeDef {
        private int id;
        private String key;
        private String name;
        private String role;
        private double demand;
    }

    /** One undirected edge between two node keys; {@code resistance} is required. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeDef {
        private String source;
        private String target;
        private Double resistance;
        private AssetDef asset;
    }

    /** Optional asset condition; missing fields keep their nominal values. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class AssetDef {
        private Double ageYears;
        private Double corrosion;
        private Double vibration;
        private Double harmonicDistortion;
        private Double oilQuality;
        private Integer tripCount;
    }
}
