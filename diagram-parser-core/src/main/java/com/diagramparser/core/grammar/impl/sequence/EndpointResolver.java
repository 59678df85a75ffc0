package com.diagramparser.core.grammar.impl.sequence;

import com.diagramparser.core.model.sequence.Activate;
import com.diagramparser.core.model.sequence.Alt;
import com.diagramparser.core.model.sequence.Create;
import com.diagramparser.core.model.sequence.Critical;
import com.diagramparser.core.model.sequence.Deactivate;
import com.diagramparser.core.model.sequence.Destroy;
import com.diagramparser.core.model.sequence.Loop;
import com.diagramparser.core.model.sequence.Message;
import com.diagramparser.core.model.sequence.Note;
import com.diagramparser.core.model.sequence.Opt;
import com.diagramparser.core.model.sequence.Par;
import com.diagramparser.core.model.sequence.SequenceStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a statement tree with every endpoint resolved through a
 * {@link ParticipantRegistry}, for aliases declared after their first use.
 */
final class EndpointResolver implements SequenceStatement.Visitor<SequenceStatement> {

    private final ParticipantRegistry participants;

    EndpointResolver(ParticipantRegistry participants) {
        this.participants = participants;
    }

    List<SequenceStatement> resolveAll(List<SequenceStatement> statements) {
        List<SequenceStatement> resolved = new ArrayList<>(statements.size());
        for (SequenceStatement statement : statements) {
            resolved.add(statement.accept(this));
        }
        return resolved;
    }

    @Override
    public SequenceStatement visitMessage(Message message) {
        return new Message(participants.resolve(message.from()), participants.resolve(message.to()),
            message.text(), message.arrowType());
    }

    @Override
    public SequenceStatement visitNote(Note note) {
        List<String> actors = new ArrayList<>();
        for (String actor : note.actor().split(",")) {
            actors.add(participants.resolve(actor));
        }
        return new Note(note.position(), String.join(",", actors), note.text());
    }

    @Override
    public SequenceStatement visitLoop(Loop loop) {
        return new Loop(loop.condition(), resolveAll(loop.statements()));
    }

    @Override
    public SequenceStatement visitAlt(Alt alt) {
        Alt.ElseBranch elseBranch = alt.elseBranch() == null
            ? null
            : new Alt.ElseBranch(alt.elseBranch().condition(), resolveAll(alt.elseBranch().statements()));
        return new Alt(alt.condition(), resolveAll(alt.statements()), elseBranch);
    }

    @Override
    public SequenceStatement visitOpt(Opt opt) {
        return new Opt(opt.condition(), resolveAll(opt.statements()));
    }

    @Override
    public SequenceStatement visitPar(Par par) {
        List<Par.Branch> branches = new ArrayList<>();
        for (Par.Branch branch : par.branches()) {
            branches.add(new Par.Branch(branch.condition(), resolveAll(branch.statements())));
        }
        return new Par(branches);
    }

    @Override
    public SequenceStatement visitCritical(Critical critical) {
        List<Critical.Option> options = new ArrayList<>();
        for (Critical.Option option : critical.options()) {
            options.add(new Critical.Option(option.condition(), resolveAll(option.statements())));
        }
        return new Critical(critical.condition(), resolveAll(critical.statements()), options);
    }

    @Override
    public SequenceStatement visitActivate(Activate activate) {
        return new Activate(participants.resolve(activate.actor()));
    }

    @Override
    public SequenceStatement visitDeactivate(Deactivate deactivate) {
        return new Deactivate(participants.resolve(deactivate.actor()));
    }

    @Override
    public SequenceStatement visitCreate(Create create) {
        return create;
    }

    @Override
    public SequenceStatement visitDestroy(Destroy destroy) {
        return new Destroy(participants.resolve(destroy.actor()));
    }
}
