package org.dxworks.codelint.rules.comments;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public class BanTsCommentOptions {
    public static final int DEFAULT_MINIMUM_DESCRIPTION_LENGTH = 3;

    // values: true, false, "allow-with-description" or {descriptionFormat: regex}
    @JsonProperty("ts-expect-error")
    public JsonNode tsExpectError;
    @JsonProperty("ts-ignore")
    public JsonNode tsIgnore;
    @JsonProperty("ts-nocheck")
    public JsonNode tsNocheck;
    @JsonProperty("ts-check")
    public JsonNode tsCheck;
    @JsonAlias("minimum_description_length")
    public Integer minimumDescriptionLength;

    public int resolveMinimumDescriptionLength() {
        return minimumDescriptionLength != null ? minimumDescriptionLength : DEFAULT_MINIMUM_DESCRIPTION_LENGTH;
    }
}
