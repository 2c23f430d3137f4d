package dev.autoapply.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Everything the worker needs to perform one submission.
 * Each snapshot is optional; the worker decides what a form requires.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApplicationPayload {

    private UserSnapshot user;
    private ResumeSnapshot resume;
    private ProfileSnapshot profile;
    private JobSnapshot job;
    private Integer matchScore;
    private Map<String, String> formData;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserSnapshot {
        private Long id;
        private String name;
        private String email;
        private String phone;
        private String resumeText;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResumeSnapshot {
        private Long id;
        private String filename;
        private String contentType;
        // base64
        private String fileContent;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileSnapshot {
        private String fullName;
        private String email;
        private String phoneNumber;
        private String jobTitle;
        private String bio;
        private List<String> skills;
        private List<Map<String, String>> education;
        private List<Map<String, String>> workExperience;
        private List<String> locationsOfInterest;
        private List<String> jobTitlesOfInterest;
        private Map<String, String> onlinePresence;
        private String preferredWorkArrangement;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobSnapshot {
        private String jobTitle;
        private String company;
        private String description;
        private String applyUrl;
        private String location;
        private String source;
        private String externalJobId;
        private Long jobLinkId;
    }
}
