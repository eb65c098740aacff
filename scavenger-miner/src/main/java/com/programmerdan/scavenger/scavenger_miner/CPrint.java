package com.programmerdan.scavenger.scavenger_miner;

import com.diogonunes.jcdp.color.ColoredPrinter;
import com.diogonunes.jcdp.color.api.Ansi.Attribute;
import com.diogonunes.jcdp.color.api.Ansi.BColor;
import com.diogonunes.jcdp.color.api.Ansi.FColor;

/**
 * Fluent console printer. Keeps its own style state, so give each thread its own instance.
 */
public class CPrint {
	private final ColoredPrinter coPrint;
	private final boolean color;

	private Attribute attr = Attribute.NONE;
	private FColor fore = FColor.WHITE;
	private BColor back = BColor.BLACK;

	public CPrint(boolean color) {
		this.color = color;
		this.coPrint = color ? new ColoredPrinter.Builder(2, false).build() : null;
	}

	public CPrint p(Object msg) {
		if (color) {
			coPrint.print(msg, attr, fore, back);
		} else {
			System.out.print(msg);
		}
		return this;
	}

	public CPrint fp(String format, Object... msg) {
		return p(String.format(format, msg));
	}

	public CPrint fd(long msg) {
		return p(String.format("%d", msg));
	}

	public CPrint ln(Object msg) {
		if (color) {
			coPrint.println(msg, attr, fore, back);
		} else {
			System.out.println(msg);
		}
		return this;
	}

	public CPrint ln() {
		if (color) {
			coPrint.println("", attr, fore, back);
		} else {
			System.out.println();
		}
		return this;
	}

	public CPrint a(Attribute attr) {
		if (color) coPrint.setAttribute(attr);
		this.attr = attr;
		return this;
	}

	public CPrint f(FColor color) {
		if (this.color) coPrint.setForegroundColor(color);
		this.fore = color;
		return this;
	}

	public CPrint b(BColor color) {
		if (this.color) coPrint.setBackgroundColor(color);
		this.back = color;
		return this;
	}

	public CPrint clr() {
		if (color) coPrint.clear();
		this.attr = Attribute.NONE;
		this.fore = FColor.WHITE;
		this.back = BColor.BLACK;
		return this;
	}

	/**
	 * "[worker 3] " style prefix.
	 */
	public CPrint tag(String who) {
		return this.clr().a(Attribute.DARK).f(FColor.MAGENTA).b(BColor.BLACK).p("[" + who + "] ");
	}

	public CPrint label() {
		return this.clr().a(Attribute.BOLD).f(FColor.CYAN).b(BColor.BLACK);
	}

	public CPrint msg() {
		return this.clr().a(Attribute.NONE).f(FColor.CYAN).b(BColor.BLACK);
	}

	public CPrint info() {
		return this.clr().a(Attribute.DARK).f(FColor.CYAN).b(BColor.BLACK);
	}

	public CPrint normData() {
		return this.clr().a(Attribute.BOLD).f(FColor.GREEN).b(BColor.BLACK);
	}

	public CPrint hashData() {
		return this.clr().a(Attribute.BOLD).f(FColor.YELLOW).b(BColor.BLACK);
	}

	public CPrint unitLabel() {
		return this.clr().a(Attribute.NONE).f(FColor.WHITE).b(BColor.BLACK);
	}

	public CPrint textData() {
		return this.clr().a(Attribute.DARK).f(FColor.WHITE).b(BColor.BLACK);
	}

	public CPrint alert() {
		return this.clr().a(Attribute.BOLD).f(FColor.RED).b(BColor.BLACK);
	}

	public CPrint headers() {
		return this.clr().f(FColor.CYAN).a(Attribute.LIGHT).b(BColor.BLACK);
	}
}
