package com.entity.canonical.search;

import java.util.List;

/**
 * A synonym document together with the analyzed forms of its searchable fields.
 */
public record AnalyzedDocument(
        SynonymDocument document,
        TextAnalyzer.AnalyzedValue cname,
        List<TextAnalyzer.AnalyzedValue> whitelist
) {
    public AnalyzedDocument {
        whitelist = List.copyOf(whitelist);
    }

    public static AnalyzedDocument of(SynonymDocument document, TextAnalyzer analyzer) {
        return new AnalyzedDocument(
                document,
                analyzer.analyze(document.cname()),
                document.whitelist().stream().map(analyzer::analyze).toList());
    }

    List<TextAnalyzer.AnalyzedValue> values(SearchField field) {
        return field == SearchField.CNAME ? List.of(cname) : whitelist;
    }
}
