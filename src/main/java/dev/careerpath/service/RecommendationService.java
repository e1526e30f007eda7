package dev.careerpath.service;

import dev.careerpath.config.ScoringConfig;
import dev.careerpath.model.GapLevel;
import dev.careerpath.model.RecommendationItem;
import dev.careerpath.model.RecommendationPriority;
import dev.careerpath.model.RecommendationResource;
import dev.careerpath.model.Recommendations;
import dev.careerpath.model.SkillGap;
import dev.careerpath.model.Timeframe;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the six recommendation categories from skill gaps and sub-scores. No external calls.
 */
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private static final String COURSE = "course";
    private static final String ARTICLE = "article";
    private static final String TOOL = "tool";
    private static final String COMMUNITY = "community";
    private static final String VIDEO = "video";

    private final ScoringConfig scoringConfig;

    public Recommendations build(String currentRole, String targetRole, List<SkillGap> skillGaps,
                                 ReadinessScorer.SubScores scores) {
        return Recommendations.builder()
                .skillDevelopment(skillDevelopment(targetRole, skillGaps))
                .marketPositioning(marketPositioning(currentRole, targetRole, scores.marketDemand()))
                .educationPaths(educationPaths(targetRole, skillGaps, scores.educationPath()))
                .experienceBuilding(experienceBuilding(currentRole, targetRole))
                .networkingOpportunities(networking(targetRole))
                .nextSteps(nextSteps(scores))
                .build();
    }

    List<RecommendationItem> skillDevelopment(String targetRole, List<SkillGap> skillGaps) {
        List<RecommendationItem> items = new ArrayList<>();

        String critical = skillNames(skillGaps, 3, GapLevel.HIGH);
        if (!critical.isEmpty()) {
            items.add(item("Close Critical Skill Gaps",
                    "Focus on developing these high-priority skills: " + critical
                            + ". These are the most significant barriers to your transition.",
                    RecommendationPriority.HIGH, Timeframe.IMMEDIATE,
                    resource("Udemy Courses", search("https://www.udemy.com/courses/search/", "q", critical), COURSE),
                    resource("LinkedIn Learning", search("https://www.linkedin.com/learning/search", "keywords", critical), COURSE)));
        }

        String secondary = skillNames(skillGaps, 4, GapLevel.MEDIUM);
        if (!secondary.isEmpty()) {
            items.add(item("Strengthen Secondary Skills",
                    "Develop these medium-priority skills to boost your marketability: " + secondary + ".",
                    RecommendationPriority.MEDIUM, Timeframe.SHORT_TERM,
                    resource("Coursera Specializations", search("https://www.coursera.org/search", "query", secondary), COURSE),
                    resource("YouTube Tutorials", search("https://www.youtube.com/results", "search_query", secondary + " tutorial"), VIDEO)));
        }

        items.add(item("Build a Portfolio of Projects",
                "Create practical " + targetRole + " projects that showcase your new skills in action.",
                RecommendationPriority.HIGH, Timeframe.LONG_TERM,
                resource("GitHub Project Ideas", search("https://github.com/search", "q", targetRole + " projects"), TOOL)));

        items.add(item("Pursue Relevant Certifications",
                "Research and obtain certifications that are valued for " + targetRole + " positions.",
                RecommendationPriority.MEDIUM, Timeframe.SHORT_TERM,
                resource("Industry Certifications",
                        search("https://www.google.com/search", "q", "best certifications for " + targetRole), ARTICLE)));
        return items;
    }

    List<RecommendationItem> marketPositioning(String currentRole, String targetRole, int marketDemandScore) {
        List<RecommendationItem> items = new ArrayList<>();

        items.add(item("Optimize Your Resume for ATS",
                "Tailor your resume to highlight transferable skills from " + currentRole
                        + " that apply to " + targetRole + " positions.",
                RecommendationPriority.HIGH, Timeframe.IMMEDIATE,
                resource("Resume ATS Checker", "https://www.jobscan.co/", TOOL)));

        items.add(item("Optimize Your LinkedIn Profile",
                "Update your LinkedIn profile to reflect your career transition goals, highlighting relevant skills for "
                        + targetRole + ".",
                RecommendationPriority.HIGH, Timeframe.IMMEDIATE));

        if (marketDemandScore < scoringConfig.getMarketDemandThreshold()) {
            items.add(item("Target Emerging Opportunities",
                    "The market for " + targetRole + " positions is competitive. Consider targeting adjacent roles"
                            + " or emerging niches to increase your chances.",
                    RecommendationPriority.MEDIUM, Timeframe.LONG_TERM,
                    resource("Job Market Trends",
                            "https://www.indeed.com/career-advice/finding-a-job/job-market-trends", ARTICLE)));
        } else {
            items.add(item("Leverage High Market Demand",
                    "The strong demand for " + targetRole + " positions gives you an advantage."
                            + " Focus on companies with growth in this area.",
                    RecommendationPriority.MEDIUM, Timeframe.SHORT_TERM));
        }

        items.add(item("Develop Your Personal Brand",
                "Establish yourself as an emerging professional in the " + targetRole
                        + " space through content creation and networking.",
                RecommendationPriority.MEDIUM, Timeframe.LONG_TERM));
        return items;
    }

    List<RecommendationItem> educationPaths(String targetRole, List<SkillGap> skillGaps, int educationPathScore) {
        List<RecommendationItem> items = new ArrayList<>();

        if (educationPathScore < scoringConfig.getEducationPathThreshold()) {
            items.add(item("Enroll in a Comprehensive Program",
                    "Consider a bootcamp or professional certificate program focused on " + targetRole
                            + " skills to accelerate your transition.",
                    RecommendationPriority.HIGH, Timeframe.IMMEDIATE,
                    resource("Bootcamp Rankings", "https://www.coursereport.com/best-coding-bootcamps", ARTICLE),
                    resource("Professional Certificates", search("https://www.edx.org/search", "q", targetRole), COURSE)));
        } else {
            items.add(item("Create a Self-Directed Learning Path",
                    "Your background positions you well for self-directed learning."
                            + " Focus on targeted courses to fill specific skill gaps.",
                    RecommendationPriority.MEDIUM, Timeframe.SHORT_TERM,
                    resource("Curated Learning Paths", search("https://www.pluralsight.com/search", "q", targetRole), COURSE)));
        }

        String toLearn = skillNames(skillGaps, 3, GapLevel.HIGH, GapLevel.MEDIUM);
        if (!toLearn.isEmpty()) {
            items.add(item("Take Specialized Courses",
                    "Enroll in courses focused on " + toLearn + " to close your most critical skill gaps.",
                    RecommendationPriority.HIGH, Timeframe.IMMEDIATE,
                    resource("Coursera Skills Courses", search("https://www.coursera.org/search", "query", toLearn), COURSE)));
        }

        items.add(item("Prioritize Hands-On Learning",
                "Complement theoretical knowledge with practical application through workshops, hackathons"
                        + " and real-world projects.",
                RecommendationPriority.MEDIUM, Timeframe.LONG_TERM,
                resource("Hackathon Calendar", "https://devpost.com/hackathons", COMMUNITY)));
        return items;
    }

    List<RecommendationItem> experienceBuilding(String currentRole, String targetRole) {
        return List.of(
                item("Seek Mentorship or Apprenticeship",
                        "Find a mentor currently working as a " + targetRole
                                + " who can guide your transition and provide insider knowledge.",
                        RecommendationPriority.HIGH, Timeframe.IMMEDIATE,
                        resource("ADPList Mentorship", "https://adplist.org/", COMMUNITY)),
                item("Target Hybrid or Transition Roles",
                        "Look for roles that combine elements of " + currentRole + " and " + targetRole
                                + " as stepping stones in your transition.",
                        RecommendationPriority.HIGH, Timeframe.IMMEDIATE,
                        resource("LinkedIn Jobs", search("https://www.linkedin.com/jobs/search/", "keywords",
                                currentRole + " " + targetRole), TOOL)),
                item("Contribute to Open Source Projects",
                        "Find and contribute to open source projects that use technologies relevant to "
                                + targetRole + " positions.",
                        RecommendationPriority.MEDIUM, Timeframe.SHORT_TERM,
                        resource("Good First Issues", "https://goodfirstissue.dev/", COMMUNITY)),
                item("Volunteer Your Skills",
                        "Offer your emerging " + targetRole
                                + " skills to nonprofits or community organizations to build real experience.",
                        RecommendationPriority.MEDIUM, Timeframe.SHORT_TERM,
                        resource("Catch a Fire", "https://www.catchafire.org/", COMMUNITY)));
    }

    List<RecommendationItem> networking(String targetRole) {
        return List.of(
                item("Join Online Communities",
                        "Become an active member of " + targetRole
                                + " communities on Slack, Discord and Reddit to learn from peers and build connections.",
                        RecommendationPriority.HIGH, Timeframe.IMMEDIATE,
                        resource("Reddit Communities", search("https://www.reddit.com/search/", "q", targetRole), COMMUNITY)),
                item("Connect with Professionals",
                        "Reach out to people who have successfully transitioned to " + targetRole
                                + " positions for advice and networking.",
                        RecommendationPriority.HIGH, Timeframe.IMMEDIATE,
                        resource("LinkedIn Networking", search("https://www.linkedin.com/search/results/people/",
                                "keywords", targetRole), TOOL)),
                item("Attend Industry Events and Conferences",
                        "Participate in " + targetRole
                                + "-focused conferences, workshops and meetups to build connections and visibility.",
                        RecommendationPriority.MEDIUM, Timeframe.SHORT_TERM,
                        resource("Meetup Groups", search("https://www.meetup.com/find/", "keywords", targetRole), COMMUNITY)),
                item("Conduct Informational Interviews",
                        "Request brief conversations with " + targetRole
                                + " professionals to learn about their career paths and gain insights.",
                        RecommendationPriority.MEDIUM, Timeframe.SHORT_TERM));
    }

    /**
     * Leads with the action for the weakest sub-score. Ties keep declaration order.
     */
    List<RecommendationItem> nextSteps(ReadinessScorer.SubScores scores) {
        List<RecommendationItem> items = new ArrayList<>();
        items.add(firstAction(weakestArea(scores)));

        items.add(item("Build Your Professional Portfolio",
                "Create a professional website showcasing your projects, skills and transition journey.",
                RecommendationPriority.HIGH, Timeframe.SHORT_TERM,
                resource("Portfolio Templates", "https://github.com/topics/portfolio-template", TOOL)));
        items.add(item("Prepare for Interviews",
                "Research common interview questions for your target role and practice your responses,"
                        + " especially around your career transition.",
                RecommendationPriority.MEDIUM, Timeframe.SHORT_TERM,
                resource("Mock Interview Tool", "https://www.pramp.com/", TOOL)));
        items.add(item("Schedule Regular Progress Assessments",
                "Set monthly check-ins to evaluate your progress and adjust your transition strategy as needed.",
                RecommendationPriority.MEDIUM, Timeframe.LONG_TERM));
        return items;
    }

    String weakestArea(ReadinessScorer.SubScores scores) {
        Map<String, Integer> byArea = new LinkedHashMap<>();
        byArea.put("marketDemand", scores.marketDemand());
        byArea.put("skillGap", scores.skillGap());
        byArea.put("educationPath", scores.educationPath());
        byArea.put("industryTrend", scores.industryTrend());
        byArea.put("geographicalFactor", scores.geographicalFactor());
        return byArea.entrySet().stream()
                .min(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .map(Map.Entry::getKey)
                .orElse("skillGap");
    }

    private RecommendationItem firstAction(String area) {
        String title;
        String description;
        switch (area) {
            case "marketDemand":
                title = "Research Market Opportunities";
                description = "Identify specific companies and niche roles where your skills can be most competitive,"
                        + " even in a challenging market.";
                break;
            case "educationPath":
                title = "Evaluate Education Options";
                description = "Research and select the most effective learning resources for your specific"
                        + " career transition needs.";
                break;
            case "industryTrend":
                title = "Stay Current with Industry Trends";
                description = "Subscribe to industry publications and follow thought leaders to stay ahead of"
                        + " evolving requirements.";
                break;
            case "geographicalFactor":
                title = "Explore Remote Work Opportunities";
                description = "Research companies with strong remote work cultures and build skills for effective"
                        + " remote collaboration.";
                break;
            default:
                title = "Create a Skill Development Plan";
                description = "Develop a detailed plan to address your top priority skill gaps with specific courses"
                        + " and projects.";
        }
        return item(title, description, RecommendationPriority.HIGH, Timeframe.IMMEDIATE,
                resource("Career Transition Guide", "https://www.coursera.org/articles/career-change", ARTICLE));
    }

    private String skillNames(List<SkillGap> skillGaps, int limit, GapLevel... levels) {
        List<GapLevel> wanted = List.of(levels);
        return skillGaps.stream()
                .filter(gap -> wanted.contains(gap.gapLevel()))
                .limit(limit)
                .map(SkillGap::skillName)
                .collect(Collectors.joining(", "));
    }

    private String search(String baseUrl, String param, String value) {
        return UriComponentsBuilder.fromUriString(baseUrl)
                .queryParam(param, value)
                .encode()
                .toUriString();
    }

    private RecommendationResource resource(String title, String url, String type) {
        return new RecommendationResource(title, url, type);
    }

    private RecommendationItem item(String title, String description, RecommendationPriority priority,
                                    Timeframe timeframe, RecommendationResource... resources) {
        return RecommendationItem.builder()
                .title(title)
                .description(description)
                .priority(priority)
                .timeframe(timeframe)
                .resources(List.of(resources))
                .build();
    }
}
