package com.ai.reservation.entity;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Uncommitted reservation collected one field at a time during a call.
 * Any field may be null until confirmation.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
public class ReservationDraft {

    private String name;
    private Integer partySize;
    private LocalDate date;
    private String time;
    private String phone;
    private String specialRequests;

    /**
     * Wire names of the required fields that are still unset, in collection order.
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(name)) missing.add(DraftField.NAME.getWireName());
        if (partySize == null) missing.add(DraftField.PARTY_SIZE.getWireName());
        if (date == null) missing.add(DraftField.DATE.getWireName());
        if (StringUtils.isBlank(time)) missing.add(DraftField.TIME.getWireName());
        if (StringUtils.isBlank(phone)) missing.add(DraftField.PHONE.getWireName());
        return missing;
    }

    public ReservationDraft copy() {
        ReservationDraft copy = new ReservationDraft();
        copy.name = name;
        copy.partySize = partySize;
        copy.date = date;
        copy.time = time;
        copy.phone = phone;
        copy.specialRequests = specialRequests;
        return copy;
    }
}
