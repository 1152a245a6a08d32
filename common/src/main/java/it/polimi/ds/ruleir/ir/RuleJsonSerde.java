package it.polimi.ds.ruleir.ir;

public interface RuleJsonSerde {

    String jsonify(RuleNode node);

    RuleNode parseJson(String json);
}
