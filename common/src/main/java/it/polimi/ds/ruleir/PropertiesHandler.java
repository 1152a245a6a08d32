package it.polimi.ds.ruleir;

public interface PropertiesHandler {

    /**
     * @return the player index rules are analyzed for when the caller does not give one
     */
    int getDefaultPlayer();
}
