package com.dcruver.regmetrics.domain;

import com.dcruver.regmetrics.io.MarkupNode;
import com.dcruver.regmetrics.io.NodeKind;
import com.dcruver.regmetrics.io.ParsedTitle;
import com.dcruver.regmetrics.io.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a parsed tree into section records and groups them into TitleFiles.
 */
@Component
@Slf4j
public class CanonicalRecordBuilder {

    /**
     * One record per SECTION node, in document order. Empty sections are kept.
     */
    public List<SectionRecord> build(ParsedTitle parsed) {
        SourceFile source = parsed.getSource();
        String year = source != null ? source.getYear() : "";
        return build(parsed, year, parsed.getRoot().getNumber());
    }

    public List<SectionRecord> build(ParsedTitle parsed, String year, String titleNumber) {
        List<SectionRecord> records = new ArrayList<>();

        for (MarkupNode part : parsed.parts()) {
            for (MarkupNode child : part.getChildren()) {
                if (child.getKind() == NodeKind.SECTION) {
                    records.add(toRecord(year, titleNumber, part, null, child));
                } else if (child.getKind() == NodeKind.SUBPART) {
                    for (MarkupNode section : child.childrenOfKind(NodeKind.SECTION)) {
                        records.add(toRecord(year, titleNumber, part, child, section));
                    }
                }
            }
        }

        return records;
    }

    private SectionRecord toRecord(String year, String titleNumber, MarkupNode part, MarkupNode subpart, MarkupNode section) {
        String content = section.getText() != null ? section.getText().strip() : "";

        return SectionRecord.builder()
            .year(year.strip())
            .titleNumber(titleNumber.strip())
            .partNumber(part.getNumber().strip())
            .partTitle(part.getHeading())
            .subpartNumber(subpart != null ? subpart.getNumber().strip() : null)
            .sectionNumber(section.getNumber().strip())
            .sectionTitle(section.getHeading())
            .content(content)
            .contentStatus(content.isEmpty() ? ContentStatus.EMPTY : ContentStatus.EXTRACTED)
            .build();
    }

    /**
     * Group records into one TitleFile. The first record seen for a key wins.
     */
    public TitleFile toTitleFile(SourceFile source, List<SectionRecord> records) {
        Map<String, String> partTitles = new LinkedHashMap<>();
        Map<String, Map<String, SectionRecord>> sectionsByPart = new LinkedHashMap<>();

        for (SectionRecord record : records) {
            partTitles.putIfAbsent(record.getPartNumber(), record.getPartTitle());
            Map<String, SectionRecord> sections =
                sectionsByPart.computeIfAbsent(record.getPartNumber(), k -> new LinkedHashMap<>());

            if (sections.putIfAbsent(record.getSectionNumber(), record) != null) {
                log.warn("Duplicate section {} in part {} of {}; keeping first occurrence",
                    record.getSectionNumber(), record.getPartNumber(), source);
            }
        }

        Map<String, PartContainer> parts = new LinkedHashMap<>();
        sectionsByPart.forEach((partNumber, sections) -> parts.put(partNumber, PartContainer.builder()
            .partNumber(partNumber)
            .partTitle(partTitles.get(partNumber))
            .sections(sections)
            .build()));

        return TitleFile.builder()
            .year(source.getYear())
            .titleNumber(source.getTitleNumber())
            .volume(source.getVolume())
            .parts(parts)
            .build();
    }

    /**
     * Merge a later volume into a title. Entries already present win.
     */
    public TitleFile merge(TitleFile base, TitleFile addition) {
        Map<String, PartContainer> parts = new LinkedHashMap<>(base.getParts());

        for (PartContainer incoming : addition.getParts().values()) {
            PartContainer existing = parts.get(incoming.getPartNumber());
            if (existing == null) {
                parts.put(incoming.getPartNumber(), incoming);
                continue;
            }

            Map<String, SectionRecord> sections = new LinkedHashMap<>(existing.getSections());
            incoming.getSections().forEach(sections::putIfAbsent);
            parts.put(existing.getPartNumber(), existing.toBuilder().sections(sections).build());
        }

        return base.toBuilder().parts(parts).build();
    }
}
