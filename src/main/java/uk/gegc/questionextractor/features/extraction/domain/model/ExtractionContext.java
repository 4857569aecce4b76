package uk.gegc.questionextractor.features.extraction.domain.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one document extraction: the open question, the image counter, the images
 * waiting for their question to be flushed, and the records produced so far.
 * Never shared between extractions.
 */
public class ExtractionContext {

    private final QuestionBuffer buffer = new QuestionBuffer();
    private final Map<Integer, List<QuestionImage>> pendingImages = new HashMap<>();
    private final List<QuestionRecord> records = new ArrayList<>();
    private boolean insideQuestion;
    private int imageCounter;

    public QuestionBuffer buffer() {
        return buffer;
    }

    public boolean isInsideQuestion() {
        return insideQuestion;
    }

    public void setInsideQuestion(boolean insideQuestion) {
        this.insideQuestion = insideQuestion;
    }

    public int nextImageIndex() {
        return ++imageCounter;
    }

    public int imageCount() {
        return imageCounter;
    }

    public void bindImage(int questionNumber, QuestionImage image) {
        pendingImages.computeIfAbsent(questionNumber, number -> new ArrayList<>()).add(image);
    }

    /**
     * Removes and returns the images bound to the given question number.
     */
    public List<QuestionImage> takeImages(Integer questionNumber) {
        if (questionNumber == null) {
            return List.of();
        }
        List<QuestionImage> images = pendingImages.remove(questionNumber);
        return images != null ? images : List.of();
    }

    public void addRecord(QuestionRecord record) {
        records.add(record);
    }

    public List<QuestionRecord> records() {
        return List.copyOf(records);
    }
}
