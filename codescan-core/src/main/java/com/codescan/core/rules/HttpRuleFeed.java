package com.codescan.core.rules;

import com.codescan.core.model.RulePattern;
import com.codescan.core.rules.importer.RuleDownloader;
import com.codescan.core.rules.importer.RuleFetchException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * {@link RuleFeed} reading a JSON document of the rule store format over HTTP.
 */
public class HttpRuleFeed implements RuleFeed {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, List<RulePattern>>> BUCKETS = new TypeReference<>() { };

    private final RuleDownloader downloader;

    public HttpRuleFeed() {
        this(new RuleDownloader());
    }

    public HttpRuleFeed(RuleDownloader downloader) {
        this.downloader = downloader;
    }

    @Override
    public Map<String, List<RulePattern>> fetch(String url) throws RuleFetchException {
        byte[] body = downloader.download(url);
        try {
            JsonNode root = MAPPER.readTree(body);
            if (root == null || !root.isObject()) {
                throw new RuleFetchException("Rule feed at " + url + " is not a mapping of rule buckets");
            }
            return MAPPER.convertValue(root, BUCKETS);
        } catch (IOException | IllegalArgumentException e) {
            throw new RuleFetchException("Rule feed at " + url + " is malformed: " + e.getMessage(), e);
        }
    }
}
