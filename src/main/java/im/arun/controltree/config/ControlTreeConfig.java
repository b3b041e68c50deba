package im.arun.controltree.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ControlTreeConfig {
    private String requirementsHeader = "requirements and testing procedures";
    private List<String> ignoredCellPrefixes = new ArrayList<>(List.of(
        "Customized Approach Objective",
        "Applicability Notes",
        "Defined Approach Requirements"
    ));
    private double columnGapPt = 10.0;
    private double rowGapFactor = 1.5;
    private int wrapWidth = 98;
    private String idPrefix = "Req-";
    private String level = "base";
    private String status = "not applicable";
    private String headerTemplate = String.join("\n",
        "policy: PCI-DSS",
        "title: Configuration Recommendations of a GNU/Linux System",
        "id: pcidss_4",
        "version: '4'",
        "source: https://docs-prv.pcisecuritystandards.org/PCI%20DSS/Standard/PCI-DSS-v4_0_1.pdf",
        "levels:",
        "  - id: base",
        "controls:");
    private String notionNote = "This requirement was parsed from the official PCI DSS v4.0.1 PDF.";
}
