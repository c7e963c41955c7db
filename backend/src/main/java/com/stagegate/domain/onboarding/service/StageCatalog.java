package com.stagegate.domain.onboarding.service;

import com.stagegate.domain.onboarding.model.OnboardingFlow;
import com.stagegate.domain.onboarding.model.StageConfig;
import com.stagegate.domain.onboarding.model.StageTopic;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only stage tables for every onboarding flow, indexed by stage number.
 * Tables are validated when the catalog is built; a malformed table fails startup.
 */
@Component
public class StageCatalog {

    public static final int TOTAL_STAGES = 7;

    private final Map<OnboardingFlow, List<StageConfig>> catalogs = new EnumMap<>(OnboardingFlow.class);

    public StageCatalog() {
        register(OnboardingFlow.FOUNDER, List.of(
                stage(1, "Welcome & Introduction",
                        "Understand the founder's background, inspiration, and current business stage", 0.70,
                        List.of("What business idea are you most excited about?",
                                "What inspired this idea?",
                                "What stage is your business currently in?"),
                        topic("business_concept", "Business concept"),
                        topic("inspiration", "Inspiration"),
                        topic("current_stage", "Current stage"),
                        topic("founder_background", "Background")),
                stage(2, "Customer Discovery",
                        "Identify and validate target customer segments", 0.75,
                        List.of("Who do you think would be most interested in this solution?",
                                "What specific group of people have this problem most acutely?",
                                "How do these customers currently solve this problem?"),
                        topic("target_customers", "Target customers"),
                        topic("customer_segments", "Customer segments"),
                        topic("current_solutions", "Current solutions"),
                        topic("customer_behaviors", "Customer behaviors")),
                stage(3, "Problem Definition",
                        "Articulate the problem statement with clarity and evidence", 0.80,
                        List.of("What specific problem does your solution address?",
                                "How painful is this problem for your customers?",
                                "How often do they encounter this problem?",
                                "What evidence do you have that this problem exists?"),
                        topic("problem_description", "Problem description"),
                        topic("pain_level", "Pain level"),
                        topic("frequency", "Frequency"),
                        topic("problem_evidence", "Problem evidence")),
                stage(4, "Solution Validation",
                        "Define the solution approach and unique value proposition", 0.75,
                        List.of("How does your solution solve this problem?",
                                "What makes your approach unique?",
                                "What's your key differentiator?",
                                "Why would customers choose you over alternatives?"),
                        topic("solution_description", "Solution approach"),
                        topic("solution_mechanism", "How it works"),
                        topic("unique_value_prop", "Unique value"),
                        topic("differentiation", "Differentiation")),
                stage(5, "Competitive Analysis",
                        "Map competitors and identify positioning opportunities", 0.70,
                        List.of("Who else is solving this problem?",
                                "What alternatives do customers have?",
                                "What would make customers switch to your solution?",
                                "What are the strengths and weaknesses of existing solutions?"),
                        topic("competitors", "Competitors"),
                        topic("alternatives", "Alternatives"),
                        topic("switching_barriers", "Switching barriers"),
                        topic("competitive_advantages", "Competitive advantages")),
                stage(6, "Resources & Constraints",
                        "Understand budget, team, and constraints", 0.75,
                        List.of("What's your budget for getting started?",
                                "What skills and resources do you have available?",
                                "What are your main constraints (time, money, team)?",
                                "What channels do you have access to for reaching customers?"),
                        topic("budget_range", "Budget range"),
                        topic("available_resources", "Resources"),
                        topic("constraints", "Constraints"),
                        topic("team_capabilities", "Team capabilities"),
                        topic("available_channels", "Channels")),
                stage(7, "Goals & Next Steps",
                        "Define success metrics and immediate action items", 0.85,
                        List.of("What do you want to achieve in the next 3 months?",
                                "How will you measure success?",
                                "What's your biggest priority right now?",
                                "What's the first experiment you want to run?"),
                        topic("short_term_goals", "Short-term goals"),
                        topic("success_metrics", "Success metrics"),
                        topic("priorities", "Priorities"),
                        topic("first_experiment", "First experiment"))));

        register(OnboardingFlow.CONSULTANT, List.of(
                stage(1, "Welcome & Practice Overview",
                        "Understand the consultant's practice name, focus area, and overall positioning", 0.70,
                        List.of("What is the name of your consulting practice?",
                                "What is your main area of consulting focus?",
                                "How long have you been in consulting?"),
                        topic("practice_name", "Practice name"),
                        topic("focus_area", "Focus area"),
                        topic("years_in_business", "Years in business"),
                        topic("practice_overview", "Practice overview")),
                stage(2, "Practice Size & Structure",
                        "Understand team size, structure, and capacity", 0.75,
                        List.of("How many people are in your practice?",
                                "What is your team structure?",
                                "How many active clients do you typically manage at once?"),
                        topic("team_size", "Team size"),
                        topic("team_structure", "Team structure"),
                        topic("active_clients_capacity", "Client capacity"),
                        topic("practice_model", "Practice model")),
                stage(3, "Industries & Services",
                        "Identify industry focus and service offerings", 0.75,
                        List.of("Which industries do you primarily serve?",
                                "What are your main service offerings?",
                                "Do you have any specialized methodologies or frameworks?",
                                "What types of projects do you typically take on?"),
                        topic("target_industries", "Target industries"),
                        topic("service_offerings", "Service offerings"),
                        topic("methodologies", "Methodologies"),
                        topic("project_types", "Project types")),
                stage(4, "Current Tools & Workflow",
                        "Document current tools and workflow processes", 0.70,
                        List.of("What tools do you currently use for client management?",
                                "How do you handle project tracking and deliverables?",
                                "What is your typical client engagement workflow?"),
                        topic("current_tools", "Current tools"),
                        topic("project_tracking", "Project tracking"),
                        topic("client_workflow", "Client workflow"),
                        topic("pain_with_tools", "Tool pain points")),
                stage(5, "Client Management",
                        "Understand client relationship management approach", 0.75,
                        List.of("How do you currently onboard new clients?",
                                "What information do you typically gather from clients at the start?",
                                "How do you communicate project progress to clients?",
                                "What does your client reporting look like?"),
                        topic("client_onboarding", "Client onboarding"),
                        topic("intake_process", "Intake process"),
                        topic("progress_communication", "Progress communication"),
                        topic("reporting_approach", "Reporting approach")),
                stage(6, "Pain Points & Challenges",
                        "Understand current challenges and frustrations", 0.70,
                        List.of("What are the biggest challenges in running your practice?",
                                "Where do you spend the most time on non-billable work?",
                                "What would make the biggest difference in your day-to-day?"),
                        topic("biggest_challenges", "Biggest challenges"),
                        topic("time_sinks", "Time sinks"),
                        topic("desired_improvements", "Desired improvements"),
                        topic("frustrations", "Frustrations")),
                stage(7, "Goals & White-Label Setup",
                        "Define goals and white-label/branding preferences", 0.80,
                        List.of("What are your goals for using the platform with your clients?",
                                "Are you interested in white-labeling reports for your clients?",
                                "What branding elements would you want to customize?",
                                "How would you like your clients to perceive the AI-generated analysis?"),
                        topic("goals", "Goals"),
                        topic("white_label_interest", "White-label interest"),
                        topic("branding_preferences", "Branding preferences"),
                        topic("client_perception", "Client perception"))));
    }

    public List<StageConfig> stages(OnboardingFlow flow) {
        return catalogs.get(flow);
    }

    public Optional<StageConfig> find(OnboardingFlow flow, int stageNumber) {
        if (stageNumber < 1 || stageNumber > TOTAL_STAGES) {
            return Optional.empty();
        }
        return Optional.of(catalogs.get(flow).get(stageNumber - 1));
    }

    /**
     * @return the stage, or stage 1 when the number is out of range
     */
    public StageConfig getOrFirst(OnboardingFlow flow, int stageNumber) {
        return find(flow, stageNumber).orElse(catalogs.get(flow).get(0));
    }

    public boolean isFinalStage(int stageNumber) {
        return stageNumber == TOTAL_STAGES;
    }

    /**
     * @return every data key collected anywhere in the flow, in stage order
     */
    public Set<String> knownFields(OnboardingFlow flow) {
        Set<String> fields = new LinkedHashSet<>();
        for (StageConfig stage : catalogs.get(flow)) {
            fields.addAll(stage.dataToCollect());
        }
        return Set.copyOf(fields);
    }

    private void register(OnboardingFlow flow, List<StageConfig> stages) {
        validate(flow.name(), stages);
        catalogs.put(flow, List.copyOf(stages));
    }

    static void validate(String catalogName, List<StageConfig> stages) {
        if (stages.size() != TOTAL_STAGES) {
            throw invalid(catalogName, "expected " + TOTAL_STAGES + " stages but found " + stages.size());
        }
        Set<String> seenKeys = new HashSet<>();
        double highestEarlierThreshold = 0.0;
        for (int i = 0; i < stages.size(); i++) {
            StageConfig stage = stages.get(i);
            if (stage.stageNumber() != i + 1) {
                throw invalid(catalogName, "stage numbers must be contiguous from 1, found "
                        + stage.stageNumber() + " at position " + (i + 1));
            }
            int topics = stage.dataToCollect().size();
            if (topics < 4 || topics > 5) {
                throw invalid(catalogName, "stage " + stage.stageNumber() + " collects " + topics + " keys, expected 4-5");
            }
            int questions = stage.keyQuestions().size();
            if (questions < 3 || questions > 4) {
                throw invalid(catalogName, "stage " + stage.stageNumber() + " has " + questions + " questions, expected 3-4");
            }
            List<String> topicKeys = stage.dataTopics().stream().map(StageTopic::key).toList();
            if (!topicKeys.equals(stage.dataToCollect())) {
                throw invalid(catalogName, "stage " + stage.stageNumber() + " topics do not match its data keys");
            }
            for (String key : stage.dataToCollect()) {
                if (!seenKeys.add(key)) {
                    throw invalid(catalogName, "data key '" + key + "' is collected by more than one stage");
                }
            }
            double threshold = stage.progressThreshold();
            if (threshold < 0.5 || threshold > 1.0) {
                throw invalid(catalogName, "stage " + stage.stageNumber() + " threshold " + threshold + " outside [0.5, 1.0]");
            }
            if (stage.stageNumber() < TOTAL_STAGES) {
                highestEarlierThreshold = Math.max(highestEarlierThreshold, threshold);
            } else if (threshold <= highestEarlierThreshold) {
                throw invalid(catalogName, "final stage threshold must be the highest of all stages");
            }
        }
    }

    private static IllegalStateException invalid(String catalogName, String reason) {
        return new IllegalStateException("Invalid " + catalogName + " stage catalog: " + reason);
    }

    private static StageConfig stage(int number, String name, String objective, double threshold,
                                     List<String> questions, StageTopic... topics) {
        List<String> keys = Arrays.stream(topics).map(StageTopic::key).toList();
        return new StageConfig(number, name, objective, questions, keys, List.of(topics), threshold);
    }

    private static StageTopic topic(String key, String label) {
        return new StageTopic(key, label);
    }
}
