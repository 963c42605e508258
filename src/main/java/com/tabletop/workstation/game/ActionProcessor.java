package com.tabletop.workstation.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * State transitions for a match. Every call works on a copy of the given state and either returns
 * the new state or throws {@link GameException}; the argument is never modified.
 * <p>
 * Nothing here checks the rules of the card game. Tapping an opponent's permanent, attaching an
 * aura to a land or drawing out of turn are all accepted. Only references that do not resolve,
 * attachment loops and malformed payloads are rejected.
 */
public class ActionProcessor {

    public static final int MAX_CHAT_LENGTH = 500;
    static final int TOKEN_DEFAULT_X = 100;
    static final int TOKEN_DEFAULT_Y = 100;

    private static final Logger log = LoggerFactory.getLogger(ActionProcessor.class);

    private final RandomSource random;
    private final Clock clock;
    private final int startingHandSize;
    private final Set<String> signedCounters;

    public ActionProcessor(RandomSource random, Clock clock, int startingHandSize, Set<String> signedCounters) {
        this.random = random;
        this.clock = clock;
        this.startingHandSize = startingHandSize;
        Set<String> normalized = new HashSet<>();
        for (String counter : signedCounters) {
            normalized.add(counter.trim().toLowerCase(Locale.ROOT));
        }
        this.signedCounters = Set.copyOf(normalized);
    }

    public GameState newGame(String gameId, String name) {
        GameState state = new GameState();
        state.setGameId(gameId);
        state.setName(name);
        state.setCreatedAt(clock.millis());
        state.setTurnNumber(1);
        state.setCurrentPhase(Phase.UNTAP);
        return state;
    }

    public ActionResult addPlayer(GameState state, String playerId, String playerName, int startingLife) {
        if (state.getPlayers().size() >= GameState.MAX_PLAYERS) {
            throw GameException.capacityExceeded("Game is full");
        }
        GameState next = state.copy();
        next.getPlayers().put(playerId, Player.create(playerId, playerName, startingLife));
        if (next.getActivePlayerId() == null) {
            next.setActivePlayerId(playerId);
        }
        return new ActionResult(next, ActionOutcome.applied());
    }

    public ActionResult apply(GameState state, GameAction action) {
        GameState next = state.copy();
        Player actor = next.requirePlayer(action.getPlayerId());
        ActionPayload data = new ActionPayload(action.getData());

        ActionOutcome outcome = switch (action.getType()) {
            case MOVE_CARD -> moveCard(next, data);
            case TAP_CARD -> tapCard(next, data);
            case TOGGLE_FACE -> toggleFace(next, data);
            case ATTACH_CARD -> attachCard(next, data);
            case UNATTACH_CARD -> unattachCard(next, data);
            case ADD_COUNTER -> addCounter(next, data);
            case DRAW -> draw(actor, drawCount(data));
            case SHUFFLE -> shuffle(actor);
            case MULLIGAN -> mulligan(actor);
            case NEXT_PHASE -> nextPhase(next);
            case NEXT_TURN -> nextTurn(next);
            case CHANGE_LIFE -> changeLife(actor, data);
            case SET_LIFE -> setLife(actor, data);
            case UNTAP_ALL -> untapAll(actor);
            case CREATE_TOKEN -> createToken(actor, data);
            case CREATE_DIE -> createDie(next, actor, data);
            case ROLL_DIE -> rollDie(next, data);
            case MOVE_DIE -> moveDie(next, data);
            case REMOVE_DIE -> removeDie(next, data);
            case REORDER_HAND -> reorderHand(next, data);
            case SEND_CHAT -> sendChat(next, actor, data);
            case ADD_ARROW -> addArrow(next, actor, data);
            case REMOVE_ARROW -> removeArrow(next, data);
            case CLEAR_ARROWS -> clearArrows(next, actor);
            case LOAD_DECK -> loadDeck(actor, action.getDeck());
        };
        return new ActionResult(next, outcome);
    }

    private ActionOutcome moveCard(GameState state, ActionPayload data) {
        CardLocation from = state.requireCard(data.requireText("cardId"));
        ZoneType toZone = ZoneType.fromWire(data.requireText("toZone"));
        Integer x = data.optionalCoordinate("x");
        Integer y = data.optionalCoordinate("y");
        Integer index = data.optionalInt("index");

        Card card = from.card();
        Player owner = state.requirePlayer(card.getOwnerId());
        from.zone().getCards().remove(card);

        if (toZone != ZoneType.BATTLEFIELD) {
            card.setAttachedToId(null);
            if (from.onBattlefield()) {
                detachDependents(state, card.getId());
            }
        } else {
            if (x != null) {
                card.getData().setX(x);
            }
            if (y != null) {
                card.getData().setY(y);
            }
        }
        owner.zone(toZone).insert(card, toZone.isOrdered() ? index : null);
        return ActionOutcome.applied();
    }

    /**
     * Cards hosted by a card that left the battlefield lose their attachment.
     */
    private void detachDependents(GameState state, String hostId) {
        for (Player player : state.getPlayers().values()) {
            for (Card card : player.zone(ZoneType.BATTLEFIELD).getCards()) {
                if (hostId.equals(card.getAttachedToId())) {
                    card.setAttachedToId(null);
                }
            }
        }
    }

    private ActionOutcome tapCard(GameState state, ActionPayload data) {
        Card card = state.requireCard(data.requireText("cardId")).card();
        card.setTapped(!card.isTapped());
        return ActionOutcome.applied();
    }

    private ActionOutcome toggleFace(GameState state, ActionPayload data) {
        Card card = state.requireCard(data.requireText("cardId")).card();
        card.setFaceDown(!card.isFaceDown());
        return ActionOutcome.applied();
    }

    private ActionOutcome attachCard(GameState state, ActionPayload data) {
        String cardId = data.requireText("cardId");
        String targetId = data.requireText("targetCardId");
        if (cardId.equals(targetId)) {
            throw GameException.invalidAttachment("A card cannot be attached to itself");
        }
        CardLocation dependent = state.requireCard(cardId);
        CardLocation host = state.findCard(targetId)
                .orElseThrow(() -> GameException.invalidAttachment("Attachment target not found: " + targetId));
        if (!host.onBattlefield() || !dependent.onBattlefield()) {
            throw GameException.invalidAttachment("Attachments exist only between battlefield cards");
        }

        // walk the host's chain; reaching the dependent means the new link closes a loop
        Set<String> visited = new HashSet<>();
        String cursor = targetId;
        while (cursor != null && visited.add(cursor)) {
            if (cursor.equals(cardId)) {
                throw GameException.invalidAttachment("Attachment would create a cycle");
            }
            cursor = state.findCard(cursor).map(location -> location.card().getAttachedToId()).orElse(null);
        }

        dependent.card().setAttachedToId(targetId);
        return ActionOutcome.applied();
    }

    private ActionOutcome unattachCard(GameState state, ActionPayload data) {
        state.requireCard(data.requireText("cardId")).card().setAttachedToId(null);
        return ActionOutcome.applied();
    }

    private ActionOutcome addCounter(GameState state, ActionPayload data) {
        Card card = state.requireCard(data.requireText("cardId")).card();
        String kind = data.textOr("counterType", "counter").trim();
        int delta = data.intOr("delta", 1);

        int value = card.getData().getCounters().getOrDefault(kind, 0) + delta;
        if (!signedCounters.contains(kind.toLowerCase(Locale.ROOT))) {
            value = Math.max(0, value);
        }
        card.getData().getCounters().put(kind, value);
        return ActionOutcome.applied();
    }

    private int drawCount(ActionPayload data) {
        int count = data.intOr("count", 1);
        if (count < 0) {
            throw GameException.invalidAction("Draw count cannot be negative");
        }
        return count;
    }

    private ActionOutcome draw(Player player, int count) {
        List<Card> library = player.zone(ZoneType.LIBRARY).getCards();
        List<Card> hand = player.zone(ZoneType.HAND).getCards();
        int drawn = 0;
        while (drawn < count && !library.isEmpty()) {
            hand.add(library.remove(0));
            drawn++;
        }
        if (drawn < count) {
            log.info("partial-draw playerId={} requested={} drawn={}", player.getId(), count, drawn);
        }
        return ActionOutcome.drew(count, drawn);
    }

    private ActionOutcome shuffle(Player player) {
        random.shuffle(player.zone(ZoneType.LIBRARY).getCards());
        return ActionOutcome.applied();
    }

    private ActionOutcome mulligan(Player player) {
        List<Card> hand = player.zone(ZoneType.HAND).getCards();
        player.zone(ZoneType.LIBRARY).getCards().addAll(hand);
        hand.clear();
        shuffle(player);
        return draw(player, startingHandSize);
    }

    private ActionOutcome nextPhase(GameState state) {
        state.setCurrentPhase(state.getCurrentPhase().next());
        return ActionOutcome.applied();
    }

    private ActionOutcome nextTurn(GameState state) {
        String active = state.getActivePlayerId();
        state.setActivePlayerId(active == null
                ? state.getPlayers().keySet().stream().findFirst().orElse(null)
                : state.opponentOf(active));
        state.setTurnNumber(state.getTurnNumber() + 1);
        state.setCurrentPhase(Phase.UNTAP);
        return ActionOutcome.applied();
    }

    private ActionOutcome changeLife(Player player, ActionPayload data) {
        player.setLifeTotal(player.getLifeTotal() + data.requireInt("delta"));
        return ActionOutcome.applied();
    }

    private ActionOutcome setLife(Player player, ActionPayload data) {
        player.setLifeTotal(data.requireInt("life"));
        return ActionOutcome.applied();
    }

    private ActionOutcome untapAll(Player player) {
        for (Card card : player.zone(ZoneType.BATTLEFIELD).getCards()) {
            card.setTapped(false);
        }
        return ActionOutcome.applied();
    }

    private ActionOutcome createToken(Player player, ActionPayload data) {
        Card token = newCard(player.getId(), data.textOr("name", "Token"), null);
        token.getData().setToken(true);
        token.getData().setPower(data.textOr("power", "1"));
        token.getData().setToughness(data.textOr("toughness", "1"));
        Integer x = data.optionalCoordinate("x");
        Integer y = data.optionalCoordinate("y");
        token.getData().setX(x == null ? TOKEN_DEFAULT_X : x);
        token.getData().setY(y == null ? TOKEN_DEFAULT_Y : y);
        player.zone(ZoneType.BATTLEFIELD).getCards().add(token);
        return ActionOutcome.applied();
    }

    private ActionOutcome createDie(GameState state, Player owner, ActionPayload data) {
        DiceToken die = new DiceToken();
        die.setId(UUID.randomUUID().toString());
        die.setOwnerPlayerId(owner.getId());
        die.setDieType(DieType.fromWire(data.textOr("dieType", "d6")));
        Integer x = data.optionalCoordinate("x");
        Integer y = data.optionalCoordinate("y");
        die.setX(x == null ? 0 : x);
        die.setY(y == null ? 0 : y);
        if (data.has("value")) {
            die.setValue(data.optionalInt("value"));
        } else {
            roll(die);
        }
        state.getDiceTokens().add(die);
        return ActionOutcome.applied();
    }

    private ActionOutcome rollDie(GameState state, ActionPayload data) {
        roll(requireDie(state, data.requireText("dieId")));
        return ActionOutcome.applied();
    }

    private void roll(DiceToken die) {
        die.setValue(random.nextInt(die.getDieType().getSides()) + 1);
        die.setLastRolledAt(clock.millis());
    }

    private ActionOutcome moveDie(GameState state, ActionPayload data) {
        DiceToken die = requireDie(state, data.requireText("dieId"));
        die.setX(data.requireCoordinate("x"));
        die.setY(data.requireCoordinate("y"));
        return ActionOutcome.applied();
    }

    private ActionOutcome removeDie(GameState state, ActionPayload data) {
        DiceToken die = requireDie(state, data.requireText("dieId"));
        state.getDiceTokens().remove(die);
        return ActionOutcome.applied();
    }

    private DiceToken requireDie(GameState state, String dieId) {
        return state.getDiceTokens().stream()
                .filter(die -> die.getId().equals(dieId))
                .findFirst()
                .orElseThrow(() -> GameException.notFound("Die not found: " + dieId));
    }

    private ActionOutcome reorderHand(GameState state, ActionPayload data) {
        CardLocation location = state.requireCard(data.requireText("cardId"));
        if (location.zone().getZoneType() != ZoneType.HAND) {
            throw GameException.notFound("Card is not in a hand: " + location.card().getId());
        }
        List<Card> hand = location.zone().getCards();
        hand.remove(location.card());
        int index = Math.max(0, Math.min(data.requireInt("newIndex"), hand.size()));
        hand.add(index, location.card());
        return ActionOutcome.applied();
    }

    private ActionOutcome sendChat(GameState state, Player author, ActionPayload data) {
        String text = data.requireText("message").strip();
        if (text.isEmpty()) {
            throw GameException.invalidAction("Chat message is empty");
        }
        if (text.length() > MAX_CHAT_LENGTH) {
            text = text.substring(0, MAX_CHAT_LENGTH);
        }
        ChatMessage message = new ChatMessage();
        message.setPlayerId(author.getId());
        message.setPlayerName(author.getName());
        message.setMessage(text);
        message.setTimestamp(Instant.now(clock).toString());
        state.getChatMessages().add(message);
        return ActionOutcome.applied();
    }

    private ActionOutcome addArrow(GameState state, Player owner, ActionPayload data) {
        String cardId = state.requireCard(data.requireText("cardId")).card().getId();
        String targetCardId = data.optionalText("targetCardId");
        String targetPlayerId = data.optionalText("targetPlayerId");
        if (targetCardId == null && targetPlayerId == null) {
            throw GameException.invalidAction("Arrow needs a target card or player");
        }
        if (targetCardId != null) {
            state.requireCard(targetCardId);
        }
        if (targetPlayerId != null) {
            state.requirePlayer(targetPlayerId);
        }
        TargetingArrow arrow = new TargetingArrow();
        arrow.setId(UUID.randomUUID().toString());
        arrow.setOwnerPlayerId(owner.getId());
        arrow.setCardId(cardId);
        arrow.setTargetCardId(targetCardId);
        arrow.setTargetPlayerId(targetPlayerId);
        state.getTargetingArrows().add(arrow);
        return ActionOutcome.applied();
    }

    private ActionOutcome removeArrow(GameState state, ActionPayload data) {
        String arrowId = data.requireText("arrowId");
        if (!state.getTargetingArrows().removeIf(arrow -> arrow.getId().equals(arrowId))) {
            throw GameException.notFound("Arrow not found: " + arrowId);
        }
        return ActionOutcome.applied();
    }

    private ActionOutcome clearArrows(GameState state, Player owner) {
        state.getTargetingArrows().removeIf(arrow -> owner.getId().equals(arrow.getOwnerPlayerId()));
        return ActionOutcome.applied();
    }

    private ActionOutcome loadDeck(Player player, DeckList deck) {
        if (deck == null) {
            throw GameException.invalidAction("Deck is required");
        }
        for (String ref : deck.main()) {
            player.zone(ZoneType.LIBRARY).getCards().add(newCard(player.getId(), CardRefs.displayName(ref), ref));
        }
        for (String ref : deck.sideboard()) {
            player.zone(ZoneType.SIDEBOARD).getCards().add(newCard(player.getId(), CardRefs.displayName(ref), ref));
        }
        shuffle(player);
        log.info("deck-loaded playerId={} deck={} main={} sideboard={}",
                player.getId(), deck.name(), deck.main().size(), deck.sideboard().size());
        return ActionOutcome.applied();
    }

    private Card newCard(String ownerId, String name, String cardRef) {
        Card card = new Card();
        card.setId(UUID.randomUUID().toString());
        card.setName(name);
        card.setCardId(cardRef);
        card.setOwnerId(ownerId);
        return card;
    }
}
