package com.tony.npbStats.disambiguation;

import com.tony.npbStats.model.Player;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class DisambiguationResult {

    public enum Status {
        /** Aucun candidat pour ce nom. */
        NO_MATCH,
        /** Un seul candidat, rien à départager. */
        SINGLE_MATCH,
        /** Plusieurs candidats, un seul a des statistiques enregistrées. */
        AUTO_SELECTED,
        /** Plusieurs candidats ont des statistiques : l'appelant doit préciser l'id. */
        AMBIGUOUS,
        /** Aucun candidat n'a de statistiques dans cette ligue. */
        UNCONFIRMED
    }

    String query;
    Status status;
    @Singular
    List<Player> candidates;
    /** Candidats écartés lors d'une sélection automatique. */
    @Singular
    List<Player> otherCandidates;
    String message;

    public boolean isAmbiguous() {
        return status == Status.AMBIGUOUS;
    }

    /**
     * Le joueur retenu, seulement quand le choix est sans ambiguïté.
     */
    public Optional<Player> getSelected() {
        if ((status == Status.SINGLE_MATCH || status == Status.AUTO_SELECTED) && candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        return Optional.empty();
    }
}
