package uk.gegc.learnhub.features.progress.application;

import org.springframework.stereotype.Component;
import uk.gegc.learnhub.features.catalog.domain.model.AnswerValue;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
import uk.gegc.learnhub.features.catalog.domain.model.QuizQuestion;
import uk.gegc.learnhub.features.progress.domain.model.GradedAnswer;
import uk.gegc.learnhub.features.progress.domain.model.SubmittedAnswer;
import uk.gegc.learnhub.shared.exception.InvalidOperationException;
import uk.gegc.learnhub.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Grades a quiz submission against the lesson's questions.
 * <p>
 * Answers are matched to questions by id. Unanswered questions score zero;
 * a question without explicit points is worth one point.
 */
@Component
public class QuizGrader {

    public QuizGrade grade(Lesson lesson, List<SubmittedAnswer> submitted) {
        List<QuizQuestion> questions = lesson.getQuestions();
        if (questions == null || questions.isEmpty()) {
            throw new InvalidOperationException("Quiz lesson " + lesson.getId() + " has no questions");
        }

        Map<UUID, AnswerValue> answersByQuestion = indexAnswers(lesson, submitted);

        List<GradedAnswer> graded = new ArrayList<>(questions.size());
        int score = 0;
        int totalPoints = 0;
        for (QuizQuestion question : questions) {
            int points = question.effectivePoints();
            totalPoints += points;
            AnswerValue answer = answersByQuestion.get(question.getId());
            boolean correct = answer != null && question.getCorrectAnswer().matches(answer);
            int awarded = correct ? points : 0;
            score += awarded;
            graded.add(new GradedAnswer(question.getId(), answer, correct, awarded));
        }

        int percentage = totalPoints > 0
                ? (int) Math.round(100.0 * score / totalPoints)
                : 0;
        return new QuizGrade(graded, score, totalPoints, percentage);
    }

    private Map<UUID, AnswerValue> indexAnswers(Lesson lesson, List<SubmittedAnswer> submitted) {
        Map<UUID, AnswerValue> byQuestion = new HashMap<>();
        if (submitted == null) {
            return byQuestion;
        }
        for (SubmittedAnswer answer : submitted) {
            if (answer == null || answer.questionId() == null) {
                throw new ValidationException("Each answer must reference a question");
            }
            UUID questionId = answer.questionId();
            boolean known = lesson.getQuestions().stream()
                    .anyMatch(q -> q.getId().equals(questionId));
            if (!known) {
                throw new ValidationException("Question " + questionId + " does not belong to lesson " + lesson.getId());
            }
            if (answer.answer() == null) {
                throw new ValidationException("Answer for question " + questionId + " is missing");
            }
            if (byQuestion.putIfAbsent(questionId, answer.answer()) != null) {
                throw new ValidationException("Question " + questionId + " was answered more than once");
            }
        }
        return byQuestion;
    }
}
