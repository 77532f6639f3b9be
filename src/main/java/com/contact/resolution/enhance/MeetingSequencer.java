package com.contact.resolution.enhance;

import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.core.model.event.Meeting;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Numbers a contact's meetings in time order and classifies each one's stage.
 * Canceled meetings keep their place in the numbering.
 */
public class MeetingSequencer {

    public List<SequencedMeeting> sequence(Collection<Meeting> meetings) {
        List<Meeting> ordered = new ArrayList<>(meetings);
        ordered.sort(Comparator.comparing(Meeting::timestamp));
        List<SequencedMeeting> sequenced = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Meeting meeting = ordered.get(i);
            int number = i + 1;
            sequenced.add(new SequencedMeeting(meeting, number,
                    MeetingStage.forSequence(number, meeting.isCanceled())));
        }
        return sequenced;
    }

    /**
     * Sequences the meetings found among mixed events.
     */
    public List<SequencedMeeting> sequenceEvents(Collection<? extends Event> events) {
        List<Meeting> meetings = new ArrayList<>();
        for (Event event : events) {
            if (event instanceof Meeting meeting) {
                meetings.add(meeting);
            }
        }
        return sequence(meetings);
    }

    /**
     * Number of meetings per stage.
     */
    public static Map<MeetingStage, Integer> countByStage(List<SequencedMeeting> sequenced) {
        Map<MeetingStage, Integer> counts = new EnumMap<>(MeetingStage.class);
        for (SequencedMeeting meeting : sequenced) {
            counts.merge(meeting.stage(), 1, Integer::sum);
        }
        return counts;
    }
}
