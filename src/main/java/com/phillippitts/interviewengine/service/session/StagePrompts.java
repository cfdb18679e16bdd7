package com.phillippitts.interviewengine.service.session;

import com.phillippitts.interviewengine.domain.Stage;

import java.util.List;

/**
 * Instruction text handed to the text generator.
 */
public final class StagePrompts {

    static final String INTERVIEWER = String.join("\n",
            "You are a friendly interview assistant helping to learn about a student's interests and hobbies.",
            "Your goal is to have a natural conversation to discover what they're passionate about.",
            "",
            "Guidelines:",
            "1. Be warm, encouraging, and genuinely curious",
            "2. Ask open-ended questions about their interests",
            "3. Follow up on interesting points they mention",
            "4. When you identify a clear interest, mark it with [INTEREST: name]",
            "5. Keep responses concise and natural for voice conversation",
            "",
            "Interview stages:",
            "- greeting: Welcome and initial rapport",
            "- exploration: Broad discovery of interests",
            "- deep_dive: Detailed exploration of main interests",
            "- wrap_up: Summarize and conclude");

    static final String MARKER_REMINDER =
            "Generate your next response. Remember to mark any new interests with [INTEREST: name].";

    static final String ANALYSIS =
            "Analyze the user's message for sentiment, engagement level, and key topics mentioned. "
                    + "Reply in one short line.";

    static final String THREAD_SUMMARY = String.join("\n",
            "Summarize this interview conversation into a concise learning thread title and description.",
            "Create a title (max 100 chars) and description (max 500 chars) for a learning thread.",
            "Answer with exactly two lines: 'Title: ...' and 'Description: ...'.");

    private StagePrompts() {}

    /**
     * Stage-specific guidance. Deep dive names at most the first two interests.
     */
    static String stageGuidance(Stage stage, List<String> interestNames) {
        switch (stage) {
            case GREETING:
                return "Start by warmly greeting the student and asking about their interests or hobbies.";
            case EXPLORATION:
                return "Explore the student's interests. They've mentioned: " + String.join(", ", interestNames)
                        + ". Ask about other interests or get more details.";
            case DEEP_DIVE:
                List<String> main = interestNames.subList(0, Math.min(2, interestNames.size()));
                return "Go deeper into their main interests: " + String.join(", ", main)
                        + ". Ask specific questions about what they enjoy most.";
            case WRAP_UP:
            case TERMINATED:
            default:
                return "Summarize what you've learned about their interests: " + String.join(", ", interestNames)
                        + ". Thank them for sharing.";
        }
    }

    /**
     * Full instruction: interviewer persona, current stage, stage guidance and marker reminder.
     */
    public static String compose(Stage stage, List<String> interestNames) {
        return INTERVIEWER
                + "\n\nCurrent stage: " + stage.wireName()
                + "\n" + stageGuidance(stage, interestNames)
                + "\n\n" + MARKER_REMINDER;
    }
}
