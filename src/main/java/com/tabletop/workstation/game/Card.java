package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Card {
    private String id;
    private String name;
    private String cardId;        // catalog reference, resolved by the client
    private String ownerId;
    private boolean tapped;
    private boolean faceDown;
    private String attachedToId;
    private CardData data = new CardData();

    public Card copy() {
        Card copy = new Card();
        copy.setId(id);
        copy.setName(name);
        copy.setCardId(cardId);
        copy.setOwnerId(ownerId);
        copy.setTapped(tapped);
        copy.setFaceDown(faceDown);
        copy.setAttachedToId(attachedToId);
        copy.setData(data == null ? new CardData() : data.copy());
        return copy;
    }
}
