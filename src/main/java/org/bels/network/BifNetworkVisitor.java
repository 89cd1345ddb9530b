package org.bels.network;

import org.antlr.v4.runtime.ParserRuleContext;
import org.bels.antlr.BifBaseVisitor;
import org.bels.antlr.BifParser.CompilationUnitContext;
import org.bels.antlr.BifParser.ConditionalEntryContext;
import org.bels.antlr.BifParser.DefaultEntryContext;
import org.bels.antlr.BifParser.IdentifierContext;
import org.bels.antlr.BifParser.NumberContext;
import org.bels.antlr.BifParser.NumberListContext;
import org.bels.antlr.BifParser.ProbabilityContentContext;
import org.bels.antlr.BifParser.ProbabilityDeclarationContext;
import org.bels.antlr.BifParser.TableEntryContext;
import org.bels.antlr.BifParser.VariableContentContext;
import org.bels.antlr.BifParser.VariableDeclarationContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE RETE DA ALBERO SINTATTICO BIF - Visitor ANTLR verso BayesianNetwork
 *
 * Attraversa l'albero prodotto dalla grammatica Bif e popola un BayesianNetwork.Builder.
 * Le dichiarazioni di variabile sono visitate prima dei blocchi probability, così
 * l'ordine dei blocchi nel file non influenza la costruzione.
 *
 * FORME DI CPT SUPPORTATE:
 * - table v1, v2, ...;          valori già nel layout appiattito (variabile più veloce)
 * - (s1, s2) v1, v2, ...;       riga condizionata sugli stati dei genitori
 * - default v1, v2, ...;        valori per tutte le righe non specificate
 *
 * Ogni riga mancante o di lunghezza errata produce BifFormatException con
 * riferimento alla posizione nel file.
 */
public class BifNetworkVisitor extends BifBaseVisitor<Void> {

    private static final Logger LOGGER = Logger.getLogger(BifNetworkVisitor.class.getName());

    /** Nome usato se il file non contiene il blocco network */
    private final String fallbackName;

    private BayesianNetwork.Builder builder;

    public BifNetworkVisitor(String fallbackName) {
        this.fallbackName = fallbackName;
    }

    //region PUNTO DI INGRESSO

    /**
     * Costruisce la rete completa dall'unità di compilazione.
     *
     * @param ctx radice dell'albero sintattico
     * @return rete bayesiana costruita
     * @throws BifFormatException se dichiarazioni o CPT sono incoerenti
     */
    public BayesianNetwork buildNetwork(CompilationUnitContext ctx) {
        visitCompilationUnit(ctx);
        try {
            return builder.build();
        } catch (IllegalStateException e) {
            throw new BifFormatException(e.getMessage(), e);
        }
    }

    @Override
    public Void visitCompilationUnit(CompilationUnitContext ctx) {
        String name = ctx.networkDeclaration() != null
                ? text(ctx.networkDeclaration().identifier())
                : fallbackName;
        builder = BayesianNetwork.builder(name);

        // Prima tutte le variabili, poi le CPT
        for (VariableDeclarationContext declaration : ctx.variableDeclaration()) {
            visitVariableDeclaration(declaration);
        }
        for (ProbabilityDeclarationContext declaration : ctx.probabilityDeclaration()) {
            visitProbabilityDeclaration(declaration);
        }

        LOGGER.fine("Rete BIF " + name + ": " + ctx.variableDeclaration().size() + " variabili, "
                + ctx.probabilityDeclaration().size() + " CPT");
        return null;
    }

    //endregion

    //region VARIABILI

    @Override
    public Void visitVariableDeclaration(VariableDeclarationContext ctx) {
        String variable = text(ctx.identifier());

        List<String> states = null;
        int declaredSize = 0;
        for (VariableContentContext content : ctx.variableContent()) {
            if (content.variableDiscrete() != null) {
                if (states != null) {
                    throw error(content, "Dominio dichiarato due volte per la variabile " + variable);
                }
                declaredSize = Integer.parseInt(content.variableDiscrete().INTEGER().getText());
                states = new ArrayList<>();
                for (IdentifierContext state : content.variableDiscrete().stateList().identifier()) {
                    states.add(text(state));
                }
            }
        }

        if (states == null) {
            throw error(ctx, "La variabile " + variable + " non dichiara un dominio discreto");
        }
        if (states.size() != declaredSize) {
            throw error(ctx, "La variabile " + variable + " dichiara " + declaredSize
                    + " stati ma ne elenca " + states.size());
        }

        try {
            builder.addVariable(variable, states);
        } catch (IllegalArgumentException e) {
            throw error(ctx, e.getMessage());
        }
        return null;
    }

    //endregion

    //region TABELLE DI PROBABILITÀ

    @Override
    public Void visitProbabilityDeclaration(ProbabilityDeclarationContext ctx) {
        List<IdentifierContext> identifiers = ctx.identifier();
        String variable = text(identifiers.get(0));

        List<String> parents = new ArrayList<>();
        for (int i = 1; i < identifiers.size(); i++) {
            parents.add(text(identifiers.get(i)));
        }

        CptLayout layout = createLayout(ctx, variable, parents);

        double[] values = new double[layout.size()];
        boolean[] filled = new boolean[layout.rows()];
        double[] defaultRow = null;

        for (ProbabilityContentContext content : ctx.probabilityContent()) {
            if (content.tableEntry() != null) {
                fillTable(content.tableEntry(), layout, values, filled);
            } else if (content.conditionalEntry() != null) {
                fillConditionalRow(content.conditionalEntry(), layout, values, filled);
            } else if (content.defaultEntry() != null) {
                defaultRow = readDefaultRow(content.defaultEntry(), layout);
            }
        }

        for (int row = 0; row < layout.rows(); row++) {
            if (filled[row]) {
                continue;
            }
            if (defaultRow == null) {
                throw error(ctx, "CPT incompleta per la variabile " + variable + ": riga " + row + " mancante");
            }
            System.arraycopy(defaultRow, 0, values, row * layout.childSize(), layout.childSize());
        }

        try {
            builder.setCpt(variable, parents, values);
        } catch (IllegalArgumentException e) {
            throw error(ctx, e.getMessage());
        }
        return null;
    }

    private CptLayout createLayout(ProbabilityDeclarationContext ctx, String variable, List<String> parents) {
        try {
            List<List<String>> parentStates = new ArrayList<>();
            for (String parent : parents) {
                parentStates.add(statesOf(parent));
            }
            return new CptLayout(variable, statesOf(variable), parentStates);
        } catch (IllegalArgumentException e) {
            throw error(ctx, e.getMessage());
        }
    }

    private void fillTable(TableEntryContext entry, CptLayout layout, double[] values, boolean[] filled) {
        double[] numbers = readNumbers(entry.numberList());
        if (numbers.length != layout.size()) {
            throw error(entry, "La tabella della variabile " + layout.variable() + " contiene " + numbers.length
                    + " valori, attesi " + layout.size());
        }
        System.arraycopy(numbers, 0, values, 0, numbers.length);
        Arrays.fill(filled, true);
    }

    private void fillConditionalRow(ConditionalEntryContext entry, CptLayout layout, double[] values, boolean[] filled) {
        List<IdentifierContext> stateNames = entry.identifier();
        if (stateNames.size() != layout.parentStates().size()) {
            throw error(entry, "La riga della variabile " + layout.variable() + " specifica " + stateNames.size()
                    + " stati, attesi " + layout.parentStates().size());
        }

        // Indice di riga row-major sui genitori
        int row = 0;
        for (int i = 0; i < stateNames.size(); i++) {
            List<String> states = layout.parentStates().get(i);
            int stateIndex = states.indexOf(text(stateNames.get(i)));
            if (stateIndex < 0) {
                throw error(entry, "Stato sconosciuto " + text(stateNames.get(i)) + " nella CPT di " + layout.variable());
            }
            row = row * states.size() + stateIndex;
        }

        double[] numbers = readNumbers(entry.numberList());
        if (numbers.length != layout.childSize()) {
            throw error(entry, "La riga della variabile " + layout.variable() + " contiene " + numbers.length
                    + " valori, attesi " + layout.childSize());
        }
        if (filled[row]) {
            throw error(entry, "Riga duplicata nella CPT di " + layout.variable());
        }

        System.arraycopy(numbers, 0, values, row * layout.childSize(), numbers.length);
        filled[row] = true;
    }

    private double[] readDefaultRow(DefaultEntryContext entry, CptLayout layout) {
        double[] numbers = readNumbers(entry.numberList());
        if (numbers.length != layout.childSize()) {
            throw error(entry, "La riga default della variabile " + layout.variable() + " contiene "
                    + numbers.length + " valori, attesi " + layout.childSize());
        }
        return numbers;
    }

    //endregion

    //region UTILITÀ

    private List<String> statesOf(String variable) {
        return builder.getStates(variable);
    }

    private static double[] readNumbers(NumberListContext ctx) {
        List<NumberContext> numbers = ctx.number();
        double[] result = new double[numbers.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = Double.parseDouble(numbers.get(i).getText());
        }
        return result;
    }

    private static String text(IdentifierContext ctx) {
        return ctx.getText();
    }

    private static BifFormatException error(ParserRuleContext ctx, String message) {
        return new BifFormatException("Riga " + ctx.getStart().getLine() + ": " + message);
    }

    /**
     * Geometria di una CPT: stati della variabile e dei genitori.
     */
    private record CptLayout(String variable, List<String> childStates, List<List<String>> parentStates) {

        int childSize() {
            return childStates.size();
        }

        int rows() {
            int rows = 1;
            for (List<String> states : parentStates) {
                rows *= states.size();
            }
            return rows;
        }

        int size() {
            return rows() * childSize();
        }
    }

    //endregion
}
